package com.roster.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body returned to reporters. {@code error} is the stable message older clients match on. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String error, String code, String field) {

    public static ErrorPayload of(String error) {
        return new ErrorPayload(error, null, null);
    }
}
