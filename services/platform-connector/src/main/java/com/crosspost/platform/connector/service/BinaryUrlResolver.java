package com.crosspost.platform.connector.service;

import java.util.Optional;

/**
 * Turns the opaque id of a file-backed media item into a URL a social platform can fetch.
 */
public interface BinaryUrlResolver {

    Optional<String> resolve(String fileId);
}
