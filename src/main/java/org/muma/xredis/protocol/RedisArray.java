package org.muma.xredis.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * 数组 (*)
 * 不可变：LPUSH/RPUSH 通过 prepend/append 生成新数组，避免多处共享同一个列表。
 */
public record RedisArray(List<RedisMessage> elements) implements RedisMessage {

    public static final RedisArray EMPTY = new RedisArray(List.of());

    public RedisArray {
        elements = List.copyOf(elements);
    }

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(List.of(elements));
    }

    public static RedisArray ofStrings(String... values) {
        List<RedisMessage> list = new ArrayList<>(values.length);
        for (String v : values) {
            list.add(new BulkString(v));
        }
        return new RedisArray(list);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public RedisMessage get(int index) {
        return elements.get(index);
    }

    public RedisArray prepend(RedisMessage element) {
        List<RedisMessage> list = new ArrayList<>(elements.size() + 1);
        list.add(element);
        list.addAll(elements);
        return new RedisArray(list);
    }

    public RedisArray append(RedisMessage element) {
        List<RedisMessage> list = new ArrayList<>(elements.size() + 1);
        list.addAll(elements);
        list.add(element);
        return new RedisArray(list);
    }
}
