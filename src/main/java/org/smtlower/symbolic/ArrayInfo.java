package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.Kind;

/**
 * 一个 SMT 数组的登记信息。
 */
@Getter
public final class ArrayInfo {

    private final int id;
    private final String name;
    private final Kind keyKind;
    private final Kind valueKind;

    public ArrayInfo(int id, String name, Kind keyKind, Kind valueKind) {
        this.id = id;
        this.name = name;
        this.keyKind = keyKind;
        this.valueKind = valueKind;
    }

    public String smtType() {
        return "(Array " + keyKind.smtType() + " " + valueKind.smtType() + ")";
    }

    @Override
    public String toString() {
        return name + " :: " + smtType();
    }
}
