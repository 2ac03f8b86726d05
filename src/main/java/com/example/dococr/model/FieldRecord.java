package com.example.dococr.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * 营业执照(사업자등록증)字段记录
 * 所有字段初始为空串，每个字段至多被写入一次，先写入者生效
 */
public class FieldRecord {

    /**
     * 字段名
     */
    public enum Field {
        REGISTRATION_NUMBER,
        CORPORATE_NAME,
        REPRESENTATIVE,
        ESTABLISHMENT_DATE,
        CORPORATE_REGISTRATION_NUMBER,
        BUSINESS_ADDRESS,
        HEAD_ADDRESS
    }

    private final Map<Field, String> values = new EnumMap<>(Field.class);

    public FieldRecord() {
        for (Field field : Field.values()) {
            values.put(field, "");
        }
    }

    public static FieldRecord empty() {
        return new FieldRecord();
    }

    /**
     * 仅在字段为空且新值非空时写入
     *
     * @return 是否写入成功
     */
    public boolean fill(Field field, String value) {
        if (value == null || value.isBlank() || !isEmpty(field)) {
            return false;
        }
        values.put(field, value.trim());
        return true;
    }

    public boolean isEmpty(Field field) {
        return values.get(field).isEmpty();
    }

    public String get(Field field) {
        return values.get(field);
    }

    public String getRegistrationNumber() {
        return values.get(Field.REGISTRATION_NUMBER);
    }

    public String getCorporateName() {
        return values.get(Field.CORPORATE_NAME);
    }

    public String getRepresentative() {
        return values.get(Field.REPRESENTATIVE);
    }

    public String getEstablishmentDate() {
        return values.get(Field.ESTABLISHMENT_DATE);
    }

    public String getCorporateRegistrationNumber() {
        return values.get(Field.CORPORATE_REGISTRATION_NUMBER);
    }

    public String getBusinessAddress() {
        return values.get(Field.BUSINESS_ADDRESS);
    }

    public String getHeadAddress() {
        return values.get(Field.HEAD_ADDRESS);
    }

    public int filledCount() {
        return (int) values.values().stream().filter(v -> !v.isEmpty()).count();
    }

    @Override
    public String toString() {
        return "FieldRecord" + values;
    }
}
