package com.sluice.content;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sluice.model.DispatchErrorKind;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentResponse {

    private final boolean success;
    private final String query;
    private final String url;
    private final String content;
    private final Integer statusCode;
    private final String source;
    private final String servedBy;
    private final Integer attempts;
    private final String error;
    private final DispatchErrorKind errorKind;
    private final Instant timestamp;
}
