package com.codeheadsystems.gplot.dropwizard.tasks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gplot.server.storage.ImageStorage;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PurgeImagesTaskTest {

  @Mock private ImageStorage imageStorage;

  private PurgeImagesTask task;
  private StringWriter output;

  @BeforeEach
  void setUp() {
    task = new PurgeImagesTask(imageStorage);
    output = new StringWriter();
  }

  @Test
  void purgesGroup() {
    when(imageStorage.purge(7, "team1")).thenReturn(3);

    task.execute(Map.of("ageDays", List.of("7"), "group", List.of("team1")), new PrintWriter(output, true));

    assertThat(output.toString()).contains("Purged 3 image(s)");
  }

  @Test
  void withoutGroup_purgesAcrossGroups() {
    when(imageStorage.purge(0, null)).thenReturn(5);

    task.execute(Map.of("ageDays", List.of("0")), new PrintWriter(output, true));

    verify(imageStorage).purge(0, null);
    assertThat(output.toString()).contains("Purged 5 image(s)");
  }

  @Test
  void missingOrInvalidAge_printsUsage() {
    task.execute(Map.of(), new PrintWriter(output, true));
    task.execute(Map.of("ageDays", List.of("soon")), new PrintWriter(output, true));
    task.execute(Map.of("ageDays", List.of("-2")), new PrintWriter(output, true));

    assertThat(output.toString()).contains("Usage: purge-images");
    verifyNoInteractions(imageStorage);
  }
}
