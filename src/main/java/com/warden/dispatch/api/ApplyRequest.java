package com.warden.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/updates.
 *
 * @param name    update name, required
 * @param version update version; nullable
 */
public record ApplyRequest(
    String name,
    String version
) {}
