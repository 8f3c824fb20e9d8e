package com.architecture.memory.flowgraph.config;

import com.architecture.memory.flowgraph.service.translation.ScanOrder;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConverterPropertiesTest {

    @Test
    void bindsScanOrderAndLayout() {
        Map<String, String> props = new HashMap<>();
        props.put("flowgraph.converter.scan-order", "textual");
        props.put("flowgraph.converter.comment-window-lines", "3");
        props.put("flowgraph.converter.call-lookbehind-chars", "40");
        props.put("flowgraph.converter.fallback-title", "Untitled");
        props.put("flowgraph.converter.layout.column-step", "300");
        props.put("flowgraph.converter.layout.max-width", "1200");
        props.put("flowgraph.converter.layout.row-height", "200");

        ConverterProperties properties = bind(props);

        assertThat(properties.getScanOrder()).isEqualTo(ScanOrder.TEXTUAL);
        assertThat(properties.getCommentWindowLines()).isEqualTo(3);
        assertThat(properties.getCallLookbehindChars()).isEqualTo(40);
        assertThat(properties.getFallbackTitle()).isEqualTo("Untitled");
        assertThat(properties.getLayout().getColumnStep()).isEqualTo(300.0);
        assertThat(properties.getLayout().getMaxWidth()).isEqualTo(1200.0);
        assertThat(properties.getLayout().getRowHeight()).isEqualTo(200.0);
    }

    @Test
    void keepsDefaultsForUnsetKeys() {
        Map<String, String> props = new HashMap<>();
        props.put("flowgraph.converter.layout.row-height", "90");

        ConverterProperties properties = bind(props);

        assertThat(properties.getScanOrder()).isEqualTo(ScanOrder.CATEGORY);
        assertThat(properties.getCommentWindowLines()).isEqualTo(5);
        assertThat(properties.getCallLookbehindChars()).isEqualTo(20);
        assertThat(properties.getFallbackTitle()).isEqualTo("ConvertedGraph");
        assertThat(properties.getLayout().getColumnStep()).isEqualTo(250.0);
        assertThat(properties.getLayout().getRowHeight()).isEqualTo(90.0);
    }

    private ConverterProperties bind(Map<String, String> props) {
        Binder binder = new Binder(new MapConfigurationPropertySource(props));
        return binder.bind("flowgraph.converter", Bindable.of(ConverterProperties.class)).get();
    }
}
