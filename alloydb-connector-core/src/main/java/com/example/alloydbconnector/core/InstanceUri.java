package com.example.alloydbconnector.core;

import java.util.regex.Pattern;

/**
 * Address of an AlloyDB instance.
 *
 * <p>The string form is {@code projects/<project>/locations/<region>/clusters/<cluster>/instances/
 * <name>} and is what error messages and traces report.
 *
 * @param project Google Cloud project id, possibly domain-scoped ({@code example.com:project})
 * @param region region the cluster lives in
 * @param cluster cluster id
 * @param name instance id
 */
public record InstanceUri(String project, String region, String cluster, String name) {

  private static final Pattern URI_PATTERN =
      Pattern.compile(
          "projects/([^/]+)/locations/([^/]+)/clusters/([^/]+)/instances/([^/]+)");

  public InstanceUri {
    requireNonBlank(project, "project");
    requireNonBlank(region, "region");
    requireNonBlank(cluster, "cluster");
    requireNonBlank(name, "name");
  }

  /**
   * Parses the canonical string form.
   *
   * @param uri an instance URI such as {@code projects/p/locations/r/clusters/c/instances/i}
   * @return the parsed identifier
   * @throws IllegalArgumentException if the URI does not have the canonical form
   */
  public static InstanceUri parse(final String uri) {
    if (uri == null) throw new IllegalArgumentException("instance URI is required");
    final var m = URI_PATTERN.matcher(uri);
    if (!m.matches())
      throw new IllegalArgumentException(
          "invalid instance URI, expected "
              + "projects/<PROJECT>/locations/<REGION>/clusters/<CLUSTER>/instances/<INSTANCE>: "
              + uri);
    return new InstanceUri(m.group(1), m.group(2), m.group(3), m.group(4));
  }

  @Override
  public String toString() {
    return "projects/"
        + project
        + "/locations/"
        + region
        + "/clusters/"
        + cluster
        + "/instances/"
        + name;
  }

  private static void requireNonBlank(final String value, final String field) {
    if (value == null || value.isBlank())
      throw new IllegalArgumentException(field + " must not be blank");
  }
}
