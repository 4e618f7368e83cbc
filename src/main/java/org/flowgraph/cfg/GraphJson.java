package org.flowgraph.cfg;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * 控制流图的 JSON 输出：节点列表（含前驱 / 后继编号）加上 START、EXIT 的编号
 */
public class GraphJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public static String toJson(ControlFlowGraph graph) {
        return GSON.toJson(graph);
    }
}
