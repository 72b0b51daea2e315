package com.e2eq.links.core;

/**
 * What happens to the other end of a link when one end is deleted.
 */
public enum DeletePolicy {
    CASCADE,  // delete the counterpart through the full delete path
    PROMPT,   // leave it and hand a decision back to the caller
    BLOCK,    // refuse the whole deletion
    IGNORE
}
