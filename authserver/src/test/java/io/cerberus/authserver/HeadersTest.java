/*
 * Copyright 2026 The Cerberus Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cerberus.authserver;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class HeadersTest {

  @Test
  public void namesAreCaseInsensitive() {
    Headers headers = Headers.builder().add("X-Cerberus-Reason", "expired").build();

    assertThat(headers.get("x-cerberus-reason")).isEqualTo("expired");
    assertThat(headers.get("X-CERBERUS-REASON")).isEqualTo("expired");
    assertThat(headers.containsKey("X-Cerberus-Reason")).isTrue();
    assertThat(headers.names()).containsExactly("x-cerberus-reason");
  }

  @Test
  public void get_returnsFirstValue() {
    Headers headers = Headers.builder().add("accept", "text/html").add("Accept", "*/*").build();

    assertThat(headers.get("accept")).isEqualTo("text/html");
    assertThat(headers.getAll("accept")).containsExactly("text/html", "*/*").inOrder();
    assertThat(headers.size()).isEqualTo(2);
  }

  @Test
  public void get_missing() {
    assertThat(Headers.EMPTY.get("anything")).isNull();
    assertThat(Headers.EMPTY.getAll("anything")).isEmpty();
    assertThat(Headers.EMPTY.isEmpty()).isTrue();
  }

  @Test
  public void set_replacesValues() {
    Headers headers = Headers.builder()
        .add("x-group", "a")
        .add("x-group", "b")
        .set("X-Group", "c")
        .build();

    assertThat(headers.getAll("x-group")).containsExactly("c");
  }

  @Test
  public void toBuilder_leavesOriginalUntouched() {
    Headers original = Headers.of(ImmutableMap.of("x-user", "alice"));

    Headers changed = original.toBuilder().remove("x-user").add("x-team", "red").build();

    assertThat(original.get("x-user")).isEqualTo("alice");
    assertThat(changed.containsKey("x-user")).isFalse();
    assertThat(changed.get("x-team")).isEqualTo("red");
  }

  @Test
  public void equality() {
    assertThat(Headers.of(ImmutableMap.of("A", "1")))
        .isEqualTo(Headers.builder().add("a", "1").build());
    assertThat(Headers.builder().build()).isSameInstanceAs(Headers.EMPTY);
  }
}
