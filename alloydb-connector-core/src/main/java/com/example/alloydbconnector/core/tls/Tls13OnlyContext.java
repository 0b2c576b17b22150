package com.example.alloydbconnector.core.tls;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.security.KeyManagementException;
import java.security.SecureRandom;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLContextSpi;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLServerSocketFactory;
import javax.net.ssl.SSLSessionContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;

/**
 * Client {@link SSLContext} that only speaks {@value TlsConfig#PROTOCOL}.
 *
 * <p>Default and supported parameters are pinned, and every socket and engine it creates is
 * configured with them, so code handed this context cannot negotiate an older protocol. The
 * wrapped context is already initialized; {@link #init} is rejected.
 */
final class Tls13OnlyContext extends SSLContext {

  private Tls13OnlyContext(final SSLContext delegate) {
    super(new Spi(delegate), delegate.getProvider(), TlsConfig.PROTOCOL);
  }

  /** Wraps an initialized context; returns {@code context} itself when it is already pinned. */
  static SSLContext pin(final SSLContext context) {
    return context instanceof Tls13OnlyContext ? context : new Tls13OnlyContext(context);
  }

  static SSLParameters pinned(final SSLParameters params) {
    params.setProtocols(new String[] {TlsConfig.PROTOCOL});
    params.setEndpointIdentificationAlgorithm(null);
    return params;
  }

  private static final class Spi extends SSLContextSpi {

    private final SSLContext delegate;
    private final SSLSocketFactory socketFactory;

    Spi(final SSLContext delegate) {
      this.delegate = delegate;
      this.socketFactory = new PinnedSocketFactory(delegate.getSocketFactory());
    }

    @Override
    protected void engineInit(
        final KeyManager[] km, final TrustManager[] tm, final SecureRandom sr)
        throws KeyManagementException {
      throw new KeyManagementException("context is already initialized");
    }

    @Override
    protected SSLSocketFactory engineGetSocketFactory() {
      return socketFactory;
    }

    @Override
    protected SSLServerSocketFactory engineGetServerSocketFactory() {
      throw new UnsupportedOperationException("client-only context");
    }

    @Override
    protected SSLEngine engineCreateSSLEngine() {
      return pinnedEngine(delegate.createSSLEngine());
    }

    @Override
    protected SSLEngine engineCreateSSLEngine(final String host, final int port) {
      return pinnedEngine(delegate.createSSLEngine(host, port));
    }

    @Override
    protected SSLSessionContext engineGetServerSessionContext() {
      return delegate.getServerSessionContext();
    }

    @Override
    protected SSLSessionContext engineGetClientSessionContext() {
      return delegate.getClientSessionContext();
    }

    @Override
    protected SSLParameters engineGetDefaultSSLParameters() {
      return pinned(delegate.getDefaultSSLParameters());
    }

    @Override
    protected SSLParameters engineGetSupportedSSLParameters() {
      return pinned(delegate.getSupportedSSLParameters());
    }

    private SSLEngine pinnedEngine(final SSLEngine engine) {
      engine.setUseClientMode(true);
      engine.setSSLParameters(pinned(delegate.getDefaultSSLParameters()));
      return engine;
    }

    private SSLParameters socketParameters() {
      return pinned(delegate.getDefaultSSLParameters());
    }

    private final class PinnedSocketFactory extends SSLSocketFactory {

      private final SSLSocketFactory factory;

      PinnedSocketFactory(final SSLSocketFactory factory) {
        this.factory = factory;
      }

      @Override
      public String[] getDefaultCipherSuites() {
        return factory.getDefaultCipherSuites();
      }

      @Override
      public String[] getSupportedCipherSuites() {
        return factory.getSupportedCipherSuites();
      }

      @Override
      public Socket createSocket() throws IOException {
        return pin(factory.createSocket());
      }

      @Override
      public Socket createSocket(
          final Socket socket, final String host, final int port, final boolean autoClose)
          throws IOException {
        return pin(factory.createSocket(socket, host, port, autoClose));
      }

      @Override
      public Socket createSocket(
          final Socket socket, final InputStream consumed, final boolean autoClose)
          throws IOException {
        throw new UnsupportedOperationException("client-only context");
      }

      @Override
      public Socket createSocket(final String host, final int port) throws IOException {
        return pin(factory.createSocket(host, port));
      }

      @Override
      public Socket createSocket(
          final String host, final int port, final InetAddress localHost, final int localPort)
          throws IOException {
        return pin(factory.createSocket(host, port, localHost, localPort));
      }

      @Override
      public Socket createSocket(final InetAddress host, final int port) throws IOException {
        return pin(factory.createSocket(host, port));
      }

      @Override
      public Socket createSocket(
          final InetAddress address,
          final int port,
          final InetAddress localAddress,
          final int localPort)
          throws IOException {
        return pin(factory.createSocket(address, port, localAddress, localPort));
      }

      private Socket pin(final Socket socket) {
        ((SSLSocket) socket).setSSLParameters(socketParameters());
        return socket;
      }
    }
  }
}
