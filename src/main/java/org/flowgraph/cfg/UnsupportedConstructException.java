package org.flowgraph.cfg;

/**
 * 遇到构建器没有对应规则的语句类型。构建立即中止，不返回半成品图。
 */
public class UnsupportedConstructException extends RuntimeException {
    private final String construct;

    public UnsupportedConstructException(String construct) {
        this(construct, "Unsupported construct: " + construct);
    }

    public UnsupportedConstructException(String construct, String message) {
        super(message);
        this.construct = construct;
    }

    /**
     * @return 不支持的语句类型名称
     */
    public String construct() {
        return construct;
    }
}
