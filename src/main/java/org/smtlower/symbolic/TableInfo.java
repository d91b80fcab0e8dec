package org.smtlower.symbolic;

import lombok.Getter;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;

import java.util.List;

/**
 * 自动构造的查找表：按下标取元素。
 */
@Getter
public final class TableInfo {

    private final int id;
    private final Kind indexKind;
    private final Kind resultKind;
    private final List<NodeRef> elements;

    public TableInfo(int id, Kind indexKind, Kind resultKind, List<NodeRef> elements) {
        this.id = id;
        this.indexKind = indexKind;
        this.resultKind = resultKind;
        this.elements = List.copyOf(elements);
    }

    @Override
    public String toString() {
        return "table" + id + " :: " + indexKind + " -> " + resultKind + " (" + elements.size() + " elements)";
    }
}
