package integration.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import integration.core.IntegrationOptions;
import integration.core.IntegrationResult;
import integration.profile.IntegrationProfiler.IntegrationProfile;
import java.util.List;
import org.junit.jupiter.api.Test;

final class IntegrationProfilerTest {

  @Test
  void profilesEveryExample() {
    List<IntegrationProfiler.NamedIntegrand> examples = IntegrationProfiler.defaultExamples();
    IntegrationProfile profile =
        new IntegrationProfiler().profile(examples, IntegrationOptions.defaults());

    assertEquals(examples.size(), profile.runs().size());
    assertEquals(0, profile.count(IntegrationResult.Outcome.FAILED));
    assertEquals(1, profile.count(IntegrationResult.Outcome.PARTIAL), "Only the gaussian");
    assertEquals("gaussian", profile.runs().get(4).name());
  }

  @Test
  void emptyProfileIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new IntegrationProfiler().profile(List.of(), IntegrationOptions.defaults()));
  }
}
