package org.dxworks.markflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dxworks.markflow.model.ColorFormat;
import org.dxworks.markflow.model.Theme;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    public static final int TEXT_COLOR = 0xFFFFFF;
    public static final int LINK_COLOR = 0x0000FF;
    public static final int CODE_COLOR = 0xFF0000;

    /** Unorm colours keep the native values exact: white, blue and red. */
    public static final MarkflowConfig CONFIG = MarkflowConfig.with(
            new Theme(TEXT_COLOR, LINK_COLOR, CODE_COLOR), ColorFormat.RGBA8_UNORM, 1.0f);

    public static final float[] WHITE = {1.0f, 1.0f, 1.0f, 1.0f};
    public static final float[] BLUE = {0.0f, 0.0f, 1.0f, 1.0f};
    public static final float[] RED = {1.0f, 0.0f, 0.0f, 1.0f};

    public static String toApprovalJson(Object value) throws JsonProcessingException {
        return APPROVAL_MAPPER.writeValueAsString(value) + "\n";
    }
}
