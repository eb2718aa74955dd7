package com.jasmin.abuseguard.detectors.bruteforcedetector;

import java.util.Optional;

/**
 * Maps a login name to the account it belongs to. Supplied by the host application's user
 * directory; an empty result means no such account exists.
 */
@FunctionalInterface
public interface AccountResolver {
    Optional<String> resolve(String username);
}
