package com.acme.commandengine.domain;

/** Visibility of one event: who owns the aggregate and who else may see the event. */
public record EventAuthorization(String owner, boolean forAuthenticated, boolean forPublic) {}
