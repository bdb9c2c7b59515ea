package com.telemetry.compression.model;

/**
 * 压缩记录类型，编码时作为首字节写出
 */
public enum RecordType {
    /** 引用已有样本，不携带原始数据 */
    REFERENCE((byte) 1),
    /** 新样本，携带完整原始数据并插入样本池 */
    NEW_EXEMPLAR((byte) 2);

    private final byte code;

    RecordType(byte code) {
        this.code = code;
    }

    public byte getCode() { return code; }

    public static RecordType fromCode(byte code) {
        for (RecordType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown record type code: " + code);
    }
}
