package dev.cortex.item;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.cortex.fixture.ContextItemBuilder;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextItemTest {

  @Test
  void vectorIsCopiedOnTheWayInAndOut() {
    float[] source = {1f, 2f, 3f};
    ContextItem item = new ContextItemBuilder().vector(source).build();

    source[0] = 99f;
    float[] read = item.vector();
    read[1] = 99f;

    assertThat(item.vector()).containsExactly(1f, 2f, 3f);
  }

  @Test
  void equalityComparesVectorContents() {
    ContextItem a = new ContextItemBuilder().vector(1f, 2f).build();
    ContextItem b = new ContextItemBuilder().vector(1f, 2f).build();
    ContextItem c = new ContextItemBuilder().vector(1f, 3f).build();

    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a).isNotEqualTo(c);
  }

  @Test
  void missingCollectionsBecomeEmpty() {
    ContextItem item =
        new ContextItem(
            1, "t", "c", ContentType.CODE, null, null, null, null, true,
            ContextItemBuilder.BASE_TIME, ContextItemBuilder.BASE_TIME, null, 0);

    assertThat(item.tags()).isEmpty();
    assertThat(item.extraMetadata()).isEmpty();
    assertThat(item.hasVector()).isFalse();
  }

  @Test
  void negativeVersionIsRejected() {
    assertThatThrownBy(() -> new ContextItemBuilder().version(-1).build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void metadataIsImmutable() {
    ContextItem item = new ContextItemBuilder().extraMetadata(Map.of("k", "v")).build();

    assertThatThrownBy(() -> item.extraMetadata().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void toStringOmitsVectorContents() {
    ContextItem item = new ContextItemBuilder().id(7).vector(0.5f, 0.5f).build();

    assertThat(item.toString()).contains("id=7").contains("2 dims").doesNotContain("0.5");
  }

  @Test
  void contentTypeParsesWireValuesCaseInsensitively() {
    assertThat(ContentType.fromValue("Markdown")).isEqualTo(ContentType.MARKDOWN);
    assertThat(ContentType.JSON.value()).isEqualTo("json");
    assertThatThrownBy(() -> ContentType.fromValue("yaml"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("yaml");
  }
}
