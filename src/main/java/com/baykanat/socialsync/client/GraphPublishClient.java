package com.baykanat.socialsync.client;

import com.baykanat.socialsync.domain.error.UpstreamApiException;
import com.baykanat.socialsync.domain.model.AccountCredentials;

/** Graph API yazma çağrıları; her metod oluşan upstream id'yi döner. */
public interface GraphPublishClient {

    /** Medya container'ı oluşturur, creation id döner. */
    String createMediaContainer(AccountCredentials credentials, String imageUrl, String caption, String mediaType)
            throws UpstreamApiException;

    /** Daha önce oluşturulmuş container'ı yayınlar, media id döner. */
    String publishContainer(AccountCredentials credentials, String creationId) throws UpstreamApiException;

    String replyToComment(AccountCredentials credentials, String commentId, String message) throws UpstreamApiException;

    String replyToConversation(AccountCredentials credentials, String conversationId, String message)
            throws UpstreamApiException;

    String sendDirectMessage(AccountCredentials credentials, String recipientId, String message)
            throws UpstreamApiException;
}
