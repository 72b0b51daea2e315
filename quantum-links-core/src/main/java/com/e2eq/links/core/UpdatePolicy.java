package com.e2eq.links.core;

/**
 * What happens to the other end of a link when one end is updated. Updates are never blocked.
 */
public enum UpdatePolicy {
    PROPAGATE,
    PROMPT,
    IGNORE
}
