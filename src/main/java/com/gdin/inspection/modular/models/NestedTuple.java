package com.gdin.inspection.modular.models;

import lombok.Value;

import java.util.List;

/**
 * 模分解树的嵌套元组表示 (Type, [child...])。
 * children 中每个元素要么是 NestedTuple，要么是顶点标识本身。
 */
@Value
public class NestedTuple {

    NodeType type;

    List<Object> children;

    @Override
    public String toString() {
        return "(" + type + ", " + children + ")";
    }
}
