package com.example.alloydbconnector.core;

/**
 * Connection metadata of an instance, as reported by the admin API for one refresh.
 *
 * @param ipAddress address the instance's server-side proxy listens on
 * @param instanceUid stable unique id of the instance, embedded in its server certificate
 */
public record ConnectInfo(String ipAddress, String instanceUid) {}
