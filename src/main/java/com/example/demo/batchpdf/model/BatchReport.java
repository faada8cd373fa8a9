package com.example.demo.batchpdf.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BatchReport {
    PreflightReport preflight;
    List<RenderResult> results;

    public long count(RenderStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }
}
