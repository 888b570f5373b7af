package io.mersel.services.lawmd.infrastructure.akn;

import net.sf.saxon.s9api.QName;

/**
 * Akoma Ntoso 3.0 element adları.
 * <p>
 * Fedlex dışa aktarımları varsayılan namespace olarak AKN 3.0 kullanır;
 * yalnızca dönüşümde kullanılan elementler burada tanımlıdır.
 */
public final class AknNames {

    public static final String NS_AKN = "http://docs.oasis-open.org/legaldocml/ns/akn/3.0";

    public static final QName ARTICLE = akn("article");
    public static final QName PARAGRAPH = akn("paragraph");
    public static final QName CONTENT = akn("content");
    public static final QName NUM = akn("num");
    public static final QName HEADING = akn("heading");
    public static final QName LEVEL = akn("level");
    public static final QName P = akn("p");
    public static final QName BLOCK_LIST = akn("blockList");
    public static final QName LIST_INTRODUCTION = akn("listIntroduction");
    public static final QName LIST_WRAP_UP = akn("listWrapUp");
    public static final QName ITEM = akn("item");
    public static final QName AUTHORIAL_NOTE = akn("authorialNote");

    private AknNames() {
    }

    private static QName akn(String localName) {
        return new QName(NS_AKN, localName);
    }
}
