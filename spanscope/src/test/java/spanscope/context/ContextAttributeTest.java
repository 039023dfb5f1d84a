/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.context;

import org.junit.jupiter.api.Test;
import spanscope.RequestContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextAttributeTest {
  static final ContextAttribute<String> DB = ContextAttribute.create("db", String.class);

  RequestContext context = RequestContext.create();

  @Test void create_badName() {
    assertThatThrownBy(() -> ContextAttribute.create(null, String.class))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> ContextAttribute.create("", String.class))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("name is empty");
    assertThatThrownBy(() -> ContextAttribute.create("my db", String.class))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("name contains whitespace: my db");
  }

  @Test void create_nullType() {
    assertThatThrownBy(() -> ContextAttribute.create("db", null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("type == null");
  }

  @Test void getValue() {
    context.set("db", "db:S1");

    assertThat(DB.getValue(context)).isEqualTo("db:S1");
  }

  @Test void getValue_unbound() {
    assertThat(DB.getValue(context)).isNull();
  }

  @Test void getValue_nullContext() {
    assertThat(DB.getValue((RequestContext) null)).isNull();
  }

  @Test void getValue_wrongType() {
    context.set("db", 1);

    assertThatThrownBy(() -> DB.getValue(context))
      .isInstanceOf(ClassCastException.class);
  }

  @Test void updateValue_shadowsOnlyInChild() {
    DB.updateValue(context, "db:S1");
    RequestContext child = context.newChild();

    DB.updateValue(child, "db:L1");

    assertThat(DB.getValue(child)).isEqualTo("db:L1");
    assertThat(DB.getValue(context)).isEqualTo("db:S1");
  }

  @Test void equalsAndHashCode_byName() {
    ContextAttribute<Object> other = ContextAttribute.create("db", Object.class);

    assertThat(DB).isEqualTo(other);
    assertThat(DB).hasSameHashCodeAs(other);
    assertThat(DB).isNotEqualTo(ContextAttribute.create("cache", String.class));
  }
}
