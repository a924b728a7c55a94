package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of a lossy export: the document text plus a description of everything left out.
 */
public final class ExportResult {
  private final String document;
  private final List<String> warnings;

  public ExportResult(final String document, final List<String> warnings) {
    this.document = document;
    this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  public String getDocument() {
    return document;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public boolean isLossless() {
    return warnings.isEmpty();
  }

  @Override
  public String toString() {
    return "ExportResult [warnings=" + warnings + "]";
  }
}
