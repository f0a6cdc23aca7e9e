package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

/** ugc_discovered satırı. */
@Value
@Builder
public class UgcContent {

    String id;
    String username;
    String caption;
    String mediaUrl;
    String mediaType;

    /** Repost açıklaması: kaynak kullanıcı etiketlenir, #repost eklenir. */
    public String repostCaption() {
        String author = username != null ? username : "unknown";
        return caption != null && !caption.isBlank()
                ? "\uD83D\uDCF8 @" + author + ": " + caption + "\n\n#repost"
                : "\uD83D\uDCF8 @" + author + "\n\n#repost";
    }
}
