package com.vtb.attacktree.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * XML-представление спецификации для выгрузки:
 * {@code <spec><children><child/></children><nodes><node/></nodes></spec>}
 */
@Data
@JacksonXmlRootElement(localName = "spec")
@JsonPropertyOrder({"id", "label", "type", "children", "prob", "impact", "nodes"})
class XmlSpecDocument {

    private String id;
    private String label;
    private String type;

    @JacksonXmlElementWrapper(localName = "children")
    @JacksonXmlProperty(localName = "child")
    private List<String> children = new ArrayList<>();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double prob;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double impact;

    @JacksonXmlElementWrapper(localName = "nodes")
    @JacksonXmlProperty(localName = "node")
    private List<Node> nodes = new ArrayList<>();

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "label", "type", "children", "prob", "impact"})
    static class Node {
        private String id;
        private String label;
        private String type;

        @JacksonXmlElementWrapper(localName = "children")
        @JacksonXmlProperty(localName = "child")
        private List<String> children;

        private Double prob;
        private Double impact;
    }
}
