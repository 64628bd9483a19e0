package com.device.registry.resolution;

/**
 * Identity key that produced a match, strongest first.
 */
public enum MatchKey {
    SERIAL,
    MAC,
    IP,
    API_ID
}
