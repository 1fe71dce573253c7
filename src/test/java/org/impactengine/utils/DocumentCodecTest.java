package org.impactengine.utils;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
class DocumentCodecTest {

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void parseYaml_keepsDatesAsStrings() throws IOException {
        Map<String, Object> doc = DocumentCodec.parseYaml(utf8("start_date: 2024-01-01\nn: 3\nflag: true\n"));

        assertThat(doc).containsEntry("start_date", "2024-01-01")
            .containsEntry("n", 3)
            .containsEntry("flag", true);
    }

    @Test
    void parseYaml_nonMappingOrInvalid_fails() {
        assertThrows(IOException.class, () -> DocumentCodec.parseYaml(utf8("- a\n- b\n")));
        assertThrows(IOException.class, () -> DocumentCodec.parseYaml(utf8("")));
        assertThrows(IOException.class, () -> DocumentCodec.parseYaml(utf8("a: [unclosed\n")));
    }

    @Test
    void parseJson_readsObjectsAndRejectsOthers() throws IOException {
        assertThat(DocumentCodec.parseJson(utf8("{\"a\": {\"b\": [1, 2]}}")))
            .containsEntry("a", Map.of("b", List.of(1, 2)));
        assertThrows(IOException.class, () -> DocumentCodec.parseJson(utf8("[1, 2]")));
    }

    @Test
    void sorted_ordersNestedKeys() {
        Map<String, Object> tree = Map.of("b", 1, "a", Map.of("z", 1, "y", List.of(Map.of("d", 1, "c", 2))));

        Map<String, Object> sorted = DocumentCodec.sorted(tree);

        assertThat(sorted.keySet()).containsExactly("a", "b");
        @SuppressWarnings("unchecked")
        Map<String, Object> nested = (Map<String, Object>) sorted.get("a");
        assertThat(nested.keySet()).containsExactly("y", "z");
    }

    @Test
    void toYaml_writesBlockStyleThatParsesBack() throws IOException {
        byte[] yaml = DocumentCodec.toYaml(Map.of("DATA", Map.of("SOURCE", Map.of("TYPE", "file"))));

        assertThat(new String(yaml, StandardCharsets.UTF_8)).contains("DATA:\n  SOURCE:\n    TYPE: file");
        assertThat(DocumentCodec.parseYaml(yaml)).containsKey("DATA");
    }
}
