package com.gdin.inspection.modular.util;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.gdin.inspection.modular.decompose.DecompositionStateException;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NestedTuple;
import com.gdin.inspection.modular.models.NodeType;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 嵌套元组的 JSON 形式：内部节点为两元素数组 ["SERIES", [child, ...]]，叶子为顶点值本身。
 * 解码得到的顶点类型由 Jackson 决定（Integer / Long / String / Double / Boolean）。
 */
public class NestedTupleCodec {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static {
        // 一个文本只允许一棵树
        objectMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    private NestedTupleCodec() {}

    public static String encode(MdTree<?> tree) throws JsonProcessingException {
        return encodeTuple(MdTreeUtils.toNestedTuple(tree));
    }

    /**
     * @param value NestedTuple 或单个顶点
     */
    public static String encodeTuple(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toJsonNode(value));
    }

    /**
     * @return NestedTuple 或顶点值
     * @throws JsonProcessingException     不是合法 JSON
     * @throws DecompositionStateException JSON 合法但不是嵌套元组
     */
    public static Object decode(String json) throws JsonProcessingException {
        if (StrUtil.isBlank(json)) throw new DecompositionStateException("nested tuple 文本为空");
        return fromJsonNode(objectMapper.readTree(json));
    }

    public static Object decode(InputStream is) throws IOException {
        return fromJsonNode(objectMapper.readTree(is));
    }

    public static <V> MdTree<V> decodeTree(String json) throws JsonProcessingException {
        return MdTreeUtils.fromNestedTuple(decode(json));
    }

    public static <V> MdTree<V> decodeTree(InputStream is) throws IOException {
        return MdTreeUtils.fromNestedTuple(decode(is));
    }

    private static JsonNode toJsonNode(Object value) {
        if (value instanceof NestedTuple tuple) {
            ArrayNode node = objectMapper.createArrayNode();
            node.add(tuple.getType().name());
            ArrayNode children = node.addArray();
            for (Object child : tuple.getChildren()) children.add(toJsonNode(child));
            return node;
        }
        return objectMapper.valueToTree(value);
    }

    private static Object fromJsonNode(JsonNode node) throws JsonProcessingException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new DecompositionStateException("nested tuple 中出现 null");
        }
        if (!node.isArray()) {
            return objectMapper.treeToValue(node, Object.class);
        }
        if (node.size() != 2 || !node.get(0).isTextual() || !node.get(1).isArray()) {
            throw new DecompositionStateException("nested tuple 必须形如 [type, [children]]: " + node);
        }
        NodeType type;
        try {
            type = NodeType.valueOf(node.get(0).asText());
        } catch (IllegalArgumentException e) {
            throw new DecompositionStateException("未知的节点类型: " + node.get(0).asText(), e);
        }
        List<Object> children = new ArrayList<>(node.get(1).size());
        for (JsonNode child : node.get(1)) children.add(fromJsonNode(child));
        return new NestedTuple(type, children);
    }
}
