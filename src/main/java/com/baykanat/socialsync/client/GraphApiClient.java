package com.baykanat.socialsync.client;

import com.baykanat.socialsync.domain.model.ConversationFetchResult;
import com.baykanat.socialsync.domain.model.FetchResult;

import java.time.Instant;

/**
 * Graph API okuma adaptörü: veriyi çeker, kendi tablolarına yazar ve sonucu döner.
 * Hata durumunda istisna atmaz; FetchResult.errorCategory doldurulur.
 */
public interface GraphApiClient {

    FetchResult fetchAndStoreComments(String accountId, String mediaId, int limit);

    ConversationFetchResult fetchAndStoreConversations(String accountId, int limit);

    FetchResult fetchAndStoreMessages(String accountId, String conversationId, int limit);

    FetchResult fetchAndStoreTaggedMedia(String accountId, int limit);

    FetchResult fetchAndStoreHashtagMedia(String accountId, String hashtag, int limit);

    FetchResult fetchAndStoreMediaInsights(String accountId, Instant since, Instant until);
}
