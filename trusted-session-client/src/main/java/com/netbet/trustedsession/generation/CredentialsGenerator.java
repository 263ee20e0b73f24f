package com.netbet.trustedsession.generation;

import com.netbet.trustedsession.model.Credentials;

/**
 * Runs one complete generation cycle. The credentials cache refreshes through this seam.
 */
@FunctionalInterface
public interface CredentialsGenerator {

    Credentials generate() throws GenerationException;
}
