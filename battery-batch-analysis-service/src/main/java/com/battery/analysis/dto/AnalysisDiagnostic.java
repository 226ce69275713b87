package com.battery.analysis.dto;

/**
 * A condition that skipped or degraded part of a batch analysis without failing it.
 *
 * @param kind category of the condition
 * @param subject channel id or batch key the condition applies to
 * @param message explanation for reporting
 */
public record AnalysisDiagnostic(DiagnosticKind kind, String subject, String message) {

  public static AnalysisDiagnostic of(DiagnosticKind kind, String subject, String format,
      Object... args) {
    return new AnalysisDiagnostic(kind, subject, String.format(format, args));
  }
}
