package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

/** instagram_assets satırı; storagePath yayınlanacak görselin URL'idir. */
@Value
@Builder
public class MediaAsset {

    String id;
    String storagePath;
    String mediaType;
}
