package com.example.alloydbconnector.core.tls;

import static org.junit.jupiter.api.Assertions.*;

import com.example.alloydbconnector.core.InstanceUri;
import com.example.alloydbconnector.core.TestAuthority;
import com.example.alloydbconnector.core.errors.DialException;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PeerVerifierTest {

  private static final InstanceUri INSTANCE =
      InstanceUri.parse("projects/p/locations/r/clusters/c/instances/i");
  private static final String UID = "9f2d3c1e";

  private TestAuthority authority;
  private KeyPair serverKeyPair;
  private PeerVerifier verifier;

  @BeforeAll
  void setUp() {
    authority = TestAuthority.create();
    serverKeyPair = TestAuthority.sharedKeyPair();
    verifier = new PeerVerifier(INSTANCE, authority.root(), UID);
  }

  private static List<byte[]> encode(final X509Certificate... chain) throws Exception {
    final var raw = new ArrayList<byte[]>();
    for (final var certificate : chain) raw.add(certificate.getEncoded());
    return raw;
  }

  @Test
  void expectedCommonNameIsDerivedFromUid() {
    assertEquals("9f2d3c1e.server.alloydb", verifier.expectedCommonName());
  }

  @Test
  @DisplayName("Accepts a leaf issued by the root and named after the instance UID")
  void shouldAcceptInstanceCertificate() throws Exception {
    final var server = authority.issueServer(UID + ".server.alloydb", serverKeyPair);

    assertDoesNotThrow(() -> verifier.verify(encode(server)));
  }

  @Test
  @DisplayName("Accepts a chain whose trailing certificates are unrelated extras")
  void shouldIgnoreUnusedChainCertificates() throws Exception {
    final var server = authority.issueServer(UID + ".server.alloydb", serverKeyPair);

    assertDoesNotThrow(() -> verifier.verify(encode(server, authority.intermediate())));
  }

  @Test
  @DisplayName("Rejects a valid chain whose leaf names another instance")
  void shouldRejectCommonNameMismatch() throws Exception {
    final var server = authority.issueServer("other.server.alloydb", serverKeyPair);

    final var e = assertThrows(DialException.class, () -> verifier.verify(encode(server)));

    assertEquals(
        "Dial error: certificate had CN \"other.server.alloydb\", expected"
            + " \"9f2d3c1e.server.alloydb\" (instance URI ="
            + " \"projects/p/locations/r/clusters/c/instances/i\")",
        e.getMessage());
    assertNull(e.getCause());
    assertEquals(INSTANCE.toString(), e.getInstanceUri());
  }

  @Test
  @DisplayName("Rejects a correctly named leaf issued under another root")
  void shouldRejectForeignRoot() throws Exception {
    final var server =
        TestAuthority.create("Impostor").issueServer(UID + ".server.alloydb", serverKeyPair);

    final var e = assertThrows(DialException.class, () -> verifier.verify(encode(server)));

    assertTrue(e.getMessage().startsWith("Dial error: failed to verify certificate"));
    assertNotNull(e.getCause());
  }

  @Test
  void shouldRejectLeafNotValidForServerAuth() throws Exception {
    final var server = authority.issueClientOnly(UID + ".server.alloydb", serverKeyPair);

    final var e = assertThrows(DialException.class, () -> verifier.verify(encode(server)));

    assertTrue(e.getMessage().startsWith("Dial error: failed to verify certificate"));
  }

  @Test
  void shouldRejectUnparseableCertificate() {
    final var e =
        assertThrows(
            DialException.class, () -> verifier.verify(List.of(new byte[] {0x30, 0x03, 1, 2, 3})));

    assertTrue(e.getMessage().startsWith("Dial error: failed to parse X.509 certificate"));
  }

  @Test
  void shouldRejectEmptyChain() {
    final var e = assertThrows(DialException.class, () -> verifier.verify(List.of()));

    assertTrue(e.getMessage().startsWith("Dial error: failed to verify certificate"));
  }

  @Test
  void shouldExtractLastCommonName() {
    assertEquals(
        "AlloyDB Test Root CA", PeerVerifier.commonName(authority.root()).orElseThrow());
  }
}
