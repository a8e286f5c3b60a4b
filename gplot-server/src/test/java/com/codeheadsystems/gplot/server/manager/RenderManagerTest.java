package com.codeheadsystems.gplot.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gplot.model.render.RenderRequest;
import com.codeheadsystems.gplot.model.render.RenderResponse;
import com.codeheadsystems.gplot.server.exceptions.SanitizationException;
import com.codeheadsystems.gplot.server.render.GraphRenderer;
import com.codeheadsystems.gplot.server.render.GraphSpec;
import com.codeheadsystems.gplot.server.security.Sanitizer;
import com.codeheadsystems.gplot.server.storage.ImageStorage;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RenderManagerTest {

  private static final byte[] IMAGE = {1, 2, 3};
  private static final String GUID = "9b2d3f7e-4a1c-4f5e-8d6b-0c1a2b3c4d5e";

  @Mock private GraphRenderer renderer;
  @Mock private ImageStorage imageStorage;
  private RenderManager manager;

  @BeforeEach
  void setUp() {
    manager = new RenderManager(renderer, imageStorage, new Sanitizer());
  }

  private static RenderRequest request(String format, boolean proxy) {
    return new RenderRequest("Line", "Q1 <sales>", List.of(1.0, 2.0), List.of(3.0, 4.0),
        null, null, format, null, proxy);
  }

  @Test
  void render_inline_returnsBase64AndDoesNotStore() {
    when(renderer.render(any())).thenReturn(IMAGE);

    RenderResponse response = manager.render(request("png", false), "team1");

    assertThat(response.imageBase64()).isEqualTo(Base64.getEncoder().encodeToString(IMAGE));
    assertThat(response.guid()).isNull();
    verifyNoInteractions(imageStorage);
  }

  @Test
  void render_proxy_storesForGroupAndReturnsPath() {
    when(renderer.render(any())).thenReturn(IMAGE);
    when(imageStorage.saveImage(IMAGE, "svg", "team1")).thenReturn(GUID);

    RenderResponse response = manager.render(request("SVG", true), "team1");

    assertThat(response.guid()).isEqualTo(GUID);
    assertThat(response.imagePath()).isEqualTo("/images/" + GUID);
    assertThat(response.format()).isEqualTo("svg");
  }

  @Test
  void render_passesSanitizedSpecToRenderer() {
    when(renderer.render(any())).thenReturn(IMAGE);

    manager.render(request(null, false), null);

    ArgumentCaptor<GraphSpec> captor = ArgumentCaptor.forClass(GraphSpec.class);
    verify(renderer).render(captor.capture());
    GraphSpec spec = captor.getValue();
    assertThat(spec.chartType()).isEqualTo("line");
    assertThat(spec.title()).isEqualTo("Q1 &lt;sales&gt;");
    assertThat(spec.format()).isEqualTo("png");
    assertThat(spec.theme()).isEqualTo("light");
  }

  @Test
  void render_mismatchedSeries_rejectedBeforeRendering() {
    RenderRequest bad = new RenderRequest("line", "t", List.of(1.0), List.of(1.0, 2.0),
        null, null, "png", null, false);

    assertThatThrownBy(() -> manager.render(bad, null)).isInstanceOf(SanitizationException.class);
    verifyNoInteractions(renderer, imageStorage);
  }

  @Test
  void render_unknownChartType_rejected() {
    RenderRequest bad = new RenderRequest("pie", "t", List.of(1.0), List.of(1.0),
        null, null, "png", null, false);

    assertThatThrownBy(() -> manager.render(bad, null))
        .isInstanceOf(SanitizationException.class)
        .hasMessageStartingWith("Invalid chart type: pie");
  }
}
