package io.mersel.services.lawmd.infrastructure.akn;

import net.sf.saxon.s9api.Axis;
import net.sf.saxon.s9api.QName;
import net.sf.saxon.s9api.XdmNode;
import net.sf.saxon.s9api.XdmNodeKind;
import net.sf.saxon.s9api.XdmSequenceIterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Saxon {@link XdmNode} ağacı üzerinde sık kullanılan gezinme yardımcıları.
 */
public final class AknNodes {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AknNodes() {
    }

    public static boolean isElement(XdmNode node, QName name) {
        return node.getNodeKind() == XdmNodeKind.ELEMENT && name.equals(node.getNodeName());
    }

    public static boolean isText(XdmNode node) {
        return node.getNodeKind() == XdmNodeKind.TEXT;
    }

    public static Optional<XdmNode> firstChild(XdmNode node, QName name) {
        XdmSequenceIterator<XdmNode> it = node.axisIterator(Axis.CHILD, name);
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    public static List<XdmNode> children(XdmNode node, QName name) {
        return collect(node.axisIterator(Axis.CHILD, name));
    }

    public static Optional<XdmNode> firstDescendant(XdmNode node, QName name) {
        XdmSequenceIterator<XdmNode> it = node.axisIterator(Axis.DESCENDANT, name);
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    /** Belge sırasındaki tüm alt elementler. */
    public static List<XdmNode> descendants(XdmNode node, QName name) {
        return collect(node.axisIterator(Axis.DESCENDANT, name));
    }

    public static boolean hasChild(XdmNode node, QName name) {
        return node.axisIterator(Axis.CHILD, name).hasNext();
    }

    /**
     * Düğümün tüm metin içeriği, boşlukları tek boşluğa indirgenmiş olarak.
     */
    public static String text(XdmNode node) {
        return normalize(node.getStringValue());
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.strip()).replaceAll(" ");
    }

    private static List<XdmNode> collect(XdmSequenceIterator<XdmNode> it) {
        var nodes = new ArrayList<XdmNode>();
        while (it.hasNext()) {
            nodes.add(it.next());
        }
        return nodes;
    }
}
