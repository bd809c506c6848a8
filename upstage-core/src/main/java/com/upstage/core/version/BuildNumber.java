package com.upstage.core.version;

import java.util.Arrays;
import java.util.Objects;

/**
 * 宿主构建号，例如 {@code 241}、{@code 241.14494}、{@code 241.*}
 * <p>
 * 按分量逐段比较，缺失的分量视为 0；{@code *} 视为该段的最大值，仅在 untilBuild 中有意义。
 */
public final class BuildNumber implements Comparable<BuildNumber> {

    private static final int WILDCARD = Integer.MAX_VALUE;

    private final String text;
    private final int[] components;

    private BuildNumber(String text, int[] components) {
        this.text = text;
        this.components = components;
    }

    /**
     * 解析构建号
     *
     * @throws IllegalArgumentException 格式非法
     */
    public static BuildNumber parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Build number cannot be blank");
        }
        String trimmed = text.trim();
        // 去掉产品前缀，例如 IC-241.14494
        int dash = trimmed.indexOf('-');
        String numbers = dash >= 0 ? trimmed.substring(dash + 1) : trimmed;

        String[] parts = numbers.split("\\.");
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if ("*".equals(part) || "SNAPSHOT".equalsIgnoreCase(part)) {
                components[i] = WILDCARD;
                continue;
            }
            try {
                components[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid build number: " + text, e);
            }
        }
        return new BuildNumber(trimmed, components);
    }

    @Override
    public int compareTo(BuildNumber other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int left = component(i);
            int right = other.component(i);
            if (left != right) {
                return Integer.compare(left, right);
            }
        }
        return 0;
    }

    private int component(int index) {
        if (index < components.length) {
            return components[index];
        }
        // 通配符之后的分量同样视为最大值
        return components.length > 0 && components[components.length - 1] == WILDCARD ? WILDCARD : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BuildNumber that)) return false;
        return compareTo(that) == 0;
    }

    @Override
    public int hashCode() {
        // 与 compareTo 保持一致：末尾的 0 或重复的通配符不影响相等性
        int end = components.length;
        int filler = end > 0 && components[end - 1] == WILDCARD ? WILDCARD : 0;
        while (end > 0 && components[end - 1] == filler) {
            end--;
        }
        return Objects.hash(Arrays.hashCode(Arrays.copyOf(components, end)), filler);
    }

    @Override
    public String toString() {
        return text;
    }
}
