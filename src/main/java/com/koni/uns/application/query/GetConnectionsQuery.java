package com.koni.uns.application.query;

/**
 * Query for all configured connections with their current status.
 */
public class GetConnectionsQuery {
}
