package io.github.cyfko.contactql.core.model;

import java.util.Set;

/**
 * URN schemes a contact can be addressed on, and which can be used as query properties.
 *
 * @since 1.0.0
 */
public final class UrnScheme {

    public static final String TEL = "tel";
    public static final String TWITTER = "twitter";
    public static final String TWITTERID = "twitterid";
    public static final String FACEBOOK = "facebook";
    public static final String TELEGRAM = "telegram";
    public static final String MAILTO = "mailto";
    public static final String EXTERNAL = "ext";
    public static final String WHATSAPP = "whatsapp";
    public static final String VIBER = "viber";
    public static final String LINE = "line";
    public static final String WECHAT = "wechat";
    public static final String JIOCHAT = "jiochat";
    public static final String FCM = "fcm";

    /** Identifier matching a URN of any scheme. */
    public static final String ANY = "urn";

    private static final Set<String> REGISTERED = Set.of(
            TEL, TWITTER, TWITTERID, FACEBOOK, TELEGRAM, MAILTO, EXTERNAL,
            WHATSAPP, VIBER, LINE, WECHAT, JIOCHAT, FCM
    );

    private UrnScheme() {}

    public static boolean isRegistered(String scheme) {
        return scheme != null && REGISTERED.contains(scheme);
    }

    public static Set<String> registered() {
        return REGISTERED;
    }
}
