package org.muma.xredis.rdb;

/**
 * 值类型标记，对应 RedisMessage 的五种变体
 */
public class RdbType {

    public static final int STRING = 0;
    public static final int INTEGER = 1;
    public static final int ERROR = 2;
    public static final int ARRAY = 3;
    public static final int NIL = 4;

    private RdbType() {
    }
}
