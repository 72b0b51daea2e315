package com.e2eq.links.records.model;

/**
 * Records that may name the character they were done for.
 */
public interface CustomerLinked {

    String getCustomerCharacterId();
}
