package com.e2eq.links.records.model;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class SaleLine {
    private String itemId;
    private int quantity;
    private BigDecimal unitPrice;
}
