package com.questrail.homeshadow.protocol.isy.config;

/**
 * Whether a fresh snapshot is merged into the shadow after a reconnect.
 * Events missed while disconnected are otherwise not recovered.
 */
public enum ReseedPolicy
{
    NEVER,
    ON_RECONNECT
}
