package com.delta.extractor.model;

import java.util.List;

public record ResumeSummary(List<String> resumedJobIds, List<String> activeJobIds) {
}
