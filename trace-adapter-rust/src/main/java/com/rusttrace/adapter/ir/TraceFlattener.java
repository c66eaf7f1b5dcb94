package com.rusttrace.adapter.ir;

import com.rusttrace.adapter.ir.LobsterModel.LobsterDocument;
import com.rusttrace.adapter.ir.LobsterModel.LobsterItem;
import com.rusttrace.adapter.ir.LobsterModel.LobsterLocation;
import com.rusttrace.adapter.static_analysis.FileReference;
import com.rusttrace.adapter.static_analysis.NodeKind;
import com.rusttrace.adapter.static_analysis.StaticTrace;
import com.rusttrace.adapter.static_analysis.TraceableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the traceable node trees of a StaticTrace into interchange records.
 *
 * SOURCE and CONTEXT nodes only contribute their children's records, FUNCTION and STRUCT nodes
 * one record each. ENUM and TRAIT subtrees are never visited. Record order is document order.
 */
public class TraceFlattener {

    private final boolean onlyTaggedFunctions;

    public TraceFlattener() {
        this(false);
    }

    /**
     * @param onlyTaggedFunctions drop Function records that carry no reference and no justification
     */
    public TraceFlattener(boolean onlyTaggedFunctions) {
        this.onlyTaggedFunctions = onlyTaggedFunctions;
    }

    public LobsterDocument flatten(StaticTrace trace) {
        List<LobsterItem> items = new ArrayList<>();
        for (TraceableNode module : trace.modules()) {
            collect(module, items);
        }

        LobsterDocument document = new LobsterDocument();
        document.data = items;
        document.generator = LobsterModel.GENERATOR;
        document.schema = LobsterModel.SCHEMA;
        document.version = LobsterModel.VERSION;
        return document;
    }

    private void collect(TraceableNode node, List<LobsterItem> out) {
        switch (node.getKind()) {
            case SOURCE, CONTEXT -> {
                for (TraceableNode child : node.getChildren()) {
                    collect(child, out);
                }
            }
            case FUNCTION, STRUCT -> {
                if (!isFilteredOut(node)) {
                    out.add(toItem(node));
                }
            }
            case ENUM, TRAIT -> { }
        }
    }

    private boolean isFilteredOut(TraceableNode node) {
        return onlyTaggedFunctions
            && node.getKind() == NodeKind.FUNCTION
            && node.getRefs().isEmpty()
            && node.getJustifications().isEmpty();
    }

    static LobsterItem toItem(TraceableNode node) {
        LobsterItem item = new LobsterItem();
        item.tag = LobsterModel.TAG_PREFIX + node.getName();
        item.name = node.getName();
        item.location = toLocation(node.getLocation());
        item.messages = new ArrayList<>();
        item.justUp = new ArrayList<>(node.getJustifications());
        item.justDown = new ArrayList<>();
        item.justGlobal = new ArrayList<>();
        item.refs = new ArrayList<>(node.getRefs());
        item.language = LobsterModel.LANGUAGE;
        item.kind = node.getKind().displayName();
        return item;
    }

    private static LobsterLocation toLocation(FileReference reference) {
        LobsterLocation location = new LobsterLocation();
        location.kind = "file";
        location.file = reference.getFilename();
        location.line = reference.getLine();
        location.column = reference.getColumn();
        return location;
    }
}
