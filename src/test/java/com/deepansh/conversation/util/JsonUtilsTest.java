package com.deepansh.conversation.util;

import com.deepansh.conversation.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonUtilsTest {

    @Test
    void parseObject_array_throws() {
        assertThatThrownBy(() -> JsonUtils.parseObject("[1,2]"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void parseObject_blank_throws() {
        assertThatThrownBy(() -> JsonUtils.parseObject("  "))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void copyOf_isDeep() {
        List<Object> items = new ArrayList<>(List.of("a"));
        Map<String, Object> nested = new HashMap<>(Map.of("items", items));
        Map<String, Object> source = new HashMap<>(Map.of("nested", nested));

        Map<String, Object> copy = JsonUtils.copyOf(source);
        items.add("b");

        assertThat(copy.get("nested").toString()).isEqualTo("{items=[a]}");
    }
}
