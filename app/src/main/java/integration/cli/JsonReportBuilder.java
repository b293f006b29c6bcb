package integration.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import integration.core.IntegrationResult;
import integration.core.IntegrationRun;
import integration.core.diagnostics.IntegrationDiagnostic;
import integration.pipeline.DerivativeCheck;
import integration.profile.IntegrationProfiler.IntegrationProfile;
import integration.profile.IntegrationProfiler.ProfileRun;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String build(IntegrationRun run, DerivativeCheck.Verdict verdict) {
    return gson.toJson(report(run, verdict));
  }

  String buildBatch(List<Map<String, Object>> reports) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", Map.of("version", VERSION, "count", reports.size()));
    root.put("results", reports);
    return gson.toJson(root);
  }

  String buildProfile(IntegrationProfile profile) {
    Map<String, Object> root = new LinkedHashMap<>();
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", profile.totalElapsedMillis());
    for (IntegrationResult.Outcome outcome : IntegrationResult.Outcome.values()) {
      meta.put(lower(outcome.name()), profile.count(outcome));
    }
    root.put("meta", meta);
    List<Map<String, Object>> runs = new ArrayList<>();
    for (ProfileRun run : profile.runs()) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("name", run.name());
      map.put("outcome", lower(run.outcome().name()));
      map.put("time_ms", run.elapsedMillis());
      map.put("field", lower(run.field().name()));
      map.put("restarted", run.restarted());
      map.put("generators", run.generatorCount());
      map.put("expression", run.expression());
      runs.add(map);
    }
    root.put("runs", runs);
    return gson.toJson(root);
  }

  Map<String, Object> report(IntegrationRun run, DerivativeCheck.Verdict verdict) {
    IntegrationResult result = run.result();
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(run));
    root.put("integrand", result.integrand().toString());
    root.put("variable", result.variable().toString());
    root.put("outcome", lower(result.outcome().name()));
    root.put("result", result.expression().toString());
    if (result instanceof IntegrationResult.Partial partial) {
      root.put("integrated_part", partial.integratedPart().toString());
      root.put("residual", partial.residual().toString());
    }
    if (result instanceof IntegrationResult.Failed failed) {
      root.put("error_kind", lower(failed.kind().name()));
      root.put("error_message", failed.message());
    }
    if (!run.generators().isEmpty()) {
      root.put("generators", run.generators());
    }
    if (verdict != null) {
      root.put("check", lower(verdict.name()));
    }
    if (!run.diagnostics().isEmpty()) {
      root.put("diagnostics", diagnosticSummaries(run.diagnostics()));
    }
    return root;
  }

  private Map<String, Object> meta(IntegrationRun run) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", run.elapsedMillis());
    meta.put("field", lower(run.field().name()));
    meta.put("restarted", run.restarted());
    return meta;
  }

  private List<Map<String, Object>> diagnosticSummaries(List<IntegrationDiagnostic> diagnostics) {
    List<Map<String, Object>> list = new ArrayList<>(diagnostics.size());
    for (IntegrationDiagnostic diagnostic : diagnostics) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("reason", lower(diagnostic.reason().name()));
      if (diagnostic.height() != null) {
        map.put("height", diagnostic.height());
      }
      if (!diagnostic.attributes().isEmpty()) {
        map.put("attributes", new TreeMap<>(diagnostic.attributes()));
      }
      list.add(map);
    }
    return list;
  }

  private static String lower(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
