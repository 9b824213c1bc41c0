package com.salachat.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Representación en el protocolo de un mensaje de la sala. Los campos opcionales
 * se serializan como {@code null}.
 */
@JsonPropertyOrder({"id", "user_id", "username", "kind", "sticker", "reply_to", "content", "created_at"})
public class MessageDto {

    private Long id;
    @JsonProperty("user_id")
    private Long userId;
    private String username;
    private String kind;
    private String sticker;
    @JsonProperty("reply_to")
    private Long replyTo;
    private String content;
    @JsonProperty("created_at")
    private Instant createdAt;

    public MessageDto() {
    }

    public MessageDto(Long id, Long userId, String username, String kind, String sticker,
                      Long replyTo, String content, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.username = username;
        this.kind = kind;
        this.sticker = sticker;
        this.replyTo = replyTo;
        this.content = content;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSticker() {
        return sticker;
    }

    public void setSticker(String sticker) {
        this.sticker = sticker;
    }

    public Long getReplyTo() {
        return replyTo;
    }

    public void setReplyTo(Long replyTo) {
        this.replyTo = replyTo;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
