package cn.bafuka.knowsearch.core;

import cn.bafuka.knowsearch.exception.CacheException;
import lombok.EqualsAndHashCode;
import org.apache.commons.codec.digest.DigestUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 结构化缓存键
 * <p>
 * 由命名空间和有序的参数列表组成，按结构比较相等性，直接作为 Map 键使用。
 * 参数顺序敏感，参数类型参与比较（Integer 5 与 Long 5 不相等）。
 * <p>
 * {@link #digest()} 提供稳定的摘要：对规范编码
 * {@code namespace|tag:len:value|tag:len:value|...} 取 SHA-256 十六进制串，
 * 其中 tag 为类型标记，len 为 value 的字符数，列表参数编码为 {@code L:n[...]}。
 */
@EqualsAndHashCode
public final class CacheKey {

    private final String namespace;

    private final List<Object> parts;

    @EqualsAndHashCode.Exclude
    private transient String digest;

    private CacheKey(String namespace, List<Object> parts) {
        this.namespace = namespace;
        this.parts = parts;
    }

    /**
     * 从异构参数派生缓存键
     *
     * @param namespace 命名空间
     * @param args      参数，保持顺序
     * @return 缓存键
     * @throws CacheException 参数类型不支持
     */
    public static CacheKey of(String namespace, Object... args) {
        if (namespace == null || namespace.isEmpty()) {
            throw new CacheException("缓存命名空间不能为空");
        }
        List<Object> parts = args == null
                ? Collections.emptyList()
                : normalize(Arrays.asList(args));
        return new CacheKey(namespace, parts);
    }

    public String getNamespace() {
        return namespace;
    }

    public List<Object> getParts() {
        return parts;
    }

    /**
     * @return 稳定的 SHA-256 摘要（十六进制）
     */
    public String digest() {
        String value = digest;
        if (value == null) {
            StringBuilder sb = new StringBuilder(64);
            sb.append(namespace);
            for (Object part : parts) {
                sb.append('|');
                appendCanonical(sb, part);
            }
            value = DigestUtils.sha256Hex(sb.toString().getBytes(StandardCharsets.UTF_8));
            digest = value;
        }
        return value;
    }

    private static List<Object> normalize(Collection<?> args) {
        List<Object> parts = new ArrayList<>(args.size());
        for (Object arg : args) {
            parts.add(normalizePart(arg));
        }
        return Collections.unmodifiableList(parts);
    }

    private static Object normalizePart(Object arg) {
        if (arg == null
                || arg instanceof String
                || arg instanceof Character
                || arg instanceof Boolean
                || arg instanceof Integer
                || arg instanceof Long
                || arg instanceof Short
                || arg instanceof Byte
                || arg instanceof Double
                || arg instanceof Float
                || arg instanceof BigInteger
                || arg instanceof Enum) {
            return arg;
        }
        if (arg instanceof BigDecimal) {
            // 1.0 与 1.00 视为同一键
            return ((BigDecimal) arg).stripTrailingZeros();
        }
        if (arg instanceof Collection) {
            return normalize((Collection<?>) arg);
        }
        throw new CacheException("不支持的缓存键参数类型: " + arg.getClass().getName());
    }

    private static void appendCanonical(StringBuilder sb, Object part) {
        if (part == null) {
            sb.append("N:0:");
            return;
        }
        if (part instanceof List) {
            List<?> list = (List<?>) part;
            sb.append("L:").append(list.size()).append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendCanonical(sb, list.get(i));
            }
            sb.append(']');
            return;
        }
        String text;
        if (part instanceof Enum) {
            Enum<?> e = (Enum<?>) part;
            text = e.getDeclaringClass().getName() + "." + e.name();
        } else if (part instanceof BigDecimal) {
            text = ((BigDecimal) part).toPlainString();
        } else {
            text = String.valueOf(part);
        }
        sb.append(typeTag(part)).append(':').append(text.length()).append(':').append(text);
    }

    private static String typeTag(Object part) {
        if (part instanceof String) {
            return "S";
        }
        if (part instanceof Character) {
            return "C";
        }
        if (part instanceof Boolean) {
            return "B";
        }
        if (part instanceof Integer) {
            return "I";
        }
        if (part instanceof Long) {
            return "J";
        }
        if (part instanceof Short) {
            return "H";
        }
        if (part instanceof Byte) {
            return "Y";
        }
        if (part instanceof Double) {
            return "D";
        }
        if (part instanceof Float) {
            return "F";
        }
        if (part instanceof BigInteger) {
            return "BI";
        }
        if (part instanceof BigDecimal) {
            return "BD";
        }
        return "E";
    }

    @Override
    public String toString() {
        return "CacheKey{" + namespace + ":" + parts + "}";
    }
}
