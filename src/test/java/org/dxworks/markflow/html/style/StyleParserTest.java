package org.dxworks.markflow.html.style;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StyleParserTest {

    @Test
    void readsShortAndLongHexColors() {
        assertEquals(OptionalInt.of(0xAABBCC), StyleParser.parseHexColor("#abc"));
        assertEquals(OptionalInt.of(0x12AB3F), StyleParser.parseHexColor(" #12ab3F "));
    }

    @Test
    void rejectsSignsAndNonHexDigits() {
        assertEquals(OptionalInt.empty(), StyleParser.parseHexColor("#-12345"));
        assertEquals(OptionalInt.empty(), StyleParser.parseHexColor("#+12345"));
        assertEquals(OptionalInt.empty(), StyleParser.parseHexColor("#-1a"));
        assertEquals(OptionalInt.empty(), StyleParser.parseHexColor("#12345g"));
        assertEquals(OptionalInt.empty(), StyleParser.parseHexColor("123456"));
    }

    @Test
    void skipsColorDeclarationsWithInvalidValues() {
        List<Style> styles = StyleParser.parse("color: #-12345; font-weight: bold");

        assertEquals(List.of(new Style.Weight(FontWeight.BOLD)), styles);
    }
}
