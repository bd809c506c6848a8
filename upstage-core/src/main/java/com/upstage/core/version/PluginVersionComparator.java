package com.upstage.core.version;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 插件版本全序比较器
 * <p>
 * 版本串按 {@code . - _ +} 和空白，以及数字与字母的交界处切分为数字段与单词段，逐段比较：
 * <ul>
 *     <li>数字段按数值比较，缺失的段视为 0，因此 1.0 与 1.0.0 相等</li>
 *     <li>单词段总是小于任何数字段 (包括缺失段)，因此 1.0-rc1 小于 1.0，1.0-beta 小于 1.0.1</li>
 *     <li>单词段之间按限定词排序：snapshot &lt; alpha/a &lt; beta/b &lt; milestone/m &lt; eap &lt; rc/cr &lt; 未知单词，
 *     未知单词之间按忽略大小写的字典序比较</li>
 *     <li>release、final、ga 在切分时被丢弃，1.0-final 与 1.0 相等</li>
 *     <li>null 最小</li>
 * </ul>
 */
public final class PluginVersionComparator implements Comparator<String> {

    public static final PluginVersionComparator INSTANCE = new PluginVersionComparator();

    private static final int UNKNOWN_WORD_RANK = 90;

    private static final Set<String> RELEASE_WORDS = Set.of("release", "final", "ga");

    private static final Map<String, Integer> QUALIFIER_RANKS = Map.ofEntries(
            Map.entry("snapshot", 10),
            Map.entry("alpha", 20),
            Map.entry("a", 20),
            Map.entry("beta", 30),
            Map.entry("b", 30),
            Map.entry("milestone", 40),
            Map.entry("m", 40),
            Map.entry("eap", 50),
            Map.entry("rc", 60),
            Map.entry("cr", 60)
    );

    private PluginVersionComparator() {
    }

    @Override
    public int compare(String left, String right) {
        if (left == null || right == null) {
            if (left == null && right == null) return 0;
            return left == null ? -1 : 1;
        }
        List<String> leftTokens = tokenize(left);
        List<String> rightTokens = tokenize(right);

        int length = Math.max(leftTokens.size(), rightTokens.size());
        for (int i = 0; i < length; i++) {
            String l = i < leftTokens.size() ? leftTokens.get(i) : "0";
            String r = i < rightTokens.size() ? rightTokens.get(i) : "0";
            int result = compareTokens(l, r);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static int compareTokens(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);

        if (leftNumeric && rightNumeric) {
            return compareNumbers(left, right);
        }
        if (leftNumeric) {
            return 1;
        }
        if (rightNumeric) {
            return -1;
        }

        int leftRank = rank(left);
        int byRank = Integer.compare(leftRank, rank(right));
        if (byRank != 0) {
            return byRank;
        }
        if (leftRank == UNKNOWN_WORD_RANK) {
            return left.toLowerCase(Locale.ROOT).compareTo(right.toLowerCase(Locale.ROOT));
        }
        return 0;
    }

    private static int compareNumbers(String left, String right) {
        String l = stripLeadingZeros(left);
        String r = stripLeadingZeros(right);
        // 按长度再按字典序比较，避免超长数字溢出
        if (l.length() != r.length()) {
            return Integer.compare(l.length(), r.length());
        }
        return l.compareTo(r);
    }

    private static String stripLeadingZeros(String number) {
        int i = 0;
        while (i < number.length() - 1 && number.charAt(i) == '0') {
            i++;
        }
        return number.substring(i);
    }

    private static int rank(String word) {
        return QUALIFIER_RANKS.getOrDefault(word.toLowerCase(Locale.ROOT), UNKNOWN_WORD_RANK);
    }

    private static boolean isNumeric(String token) {
        return token != null && !token.isEmpty() && Character.isDigit(token.charAt(0));
    }

    static List<String> tokenize(String version) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        Boolean digits = null;
        for (char c : version.trim().toCharArray()) {
            if (c == '.' || c == '-' || c == '_' || c == '+' || Character.isWhitespace(c)) {
                flush(tokens, current);
                digits = null;
                continue;
            }
            boolean isDigit = Character.isDigit(c);
            if (digits != null && digits != isDigit) {
                flush(tokens, current);
            }
            current.append(c);
            digits = isDigit;
        }
        flush(tokens, current);
        return tokens;
    }

    private static void flush(List<String> tokens, StringBuilder current) {
        if (current.length() > 0) {
            String token = current.toString();
            if (!RELEASE_WORDS.contains(token.toLowerCase(Locale.ROOT))) {
                tokens.add(token);
            }
            current.setLength(0);
        }
    }
}
