package com.e2eq.links.records.model;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Quantity of an item held at one site. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class StockPoint {
    private String siteId;
    private int quantity;
}
