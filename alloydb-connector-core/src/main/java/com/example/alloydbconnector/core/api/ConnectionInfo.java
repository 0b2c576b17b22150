package com.example.alloydbconnector.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of the {@code connectionInfo} method.
 *
 * @param ipAddress private IP address of the instance
 * @param instanceUid unique id of the instance
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectionInfo(String ipAddress, String instanceUid) {}
