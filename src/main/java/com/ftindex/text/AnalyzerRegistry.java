package com.ftindex.text;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 按名称创建分词器。内置 "standard"（不过滤停用词）与 "english"（过滤英文停用词）。
 */
public final class AnalyzerRegistry {
    private static final Map<String, Supplier<Analyzer>> FACTORIES = new ConcurrentHashMap<>();

    static {
        register("standard", StandardAnalyzer::new);
        register("english", () -> new StandardAnalyzer(true, 255));
    }

    private AnalyzerRegistry() {
    }

    public static void register(String name, Supplier<Analyzer> factory) {
        if (name == null || name.isBlank() || factory == null) {
            throw new IllegalArgumentException("分词器名称与工厂不能为空");
        }
        FACTORIES.put(name, factory);
    }

    /**
     * 创建指定名称的分词器实例。
     *
     * @throws IllegalArgumentException 名称未注册
     */
    public static Analyzer create(String name) {
        Supplier<Analyzer> factory = FACTORIES.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("未知分词器: " + name + ", 可选: " + FACTORIES.keySet());
        }
        return factory.get();
    }

    public static Set<String> names() {
        return Set.copyOf(FACTORIES.keySet());
    }
}
