package com.e2eq.links.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LinkErrorResponse {
    protected int status;
    protected String errorType;
    protected String statusMessage;
    protected String reasonMessage;
    protected String entity;
    protected List<String> details;
}
