package im.arun.jsonnav.tree;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ValueFormatterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{\"a\":1,\"b\":2}|{ 2 items }",
        "{}|{}",
        "[1,2,3]|[ 3 items ]",
        "[]|[]",
        "\"hello\"|hello",
        "12.5|12.5",
        "-3|-3",
        "true|true",
        "false|false",
        "null|null"
    })
    void formatsEveryKind(String json, String expected) throws Exception {
        assertThat(ValueFormatter.displayValue(mapper.readTree(json), 100)).isEqualTo(expected);
    }

    @Test
    void truncatesLongText() {
        assertThat(ValueFormatter.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(ValueFormatter.truncate("abc", 3)).isEqualTo("abc");
    }

    @Test
    void neverSplitsSurrogatePairs() {
        String text = "ab😀cd";

        assertThat(ValueFormatter.truncate(text, 3)).isEqualTo("ab...");
    }
}
