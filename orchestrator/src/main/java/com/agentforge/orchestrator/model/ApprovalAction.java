package com.agentforge.orchestrator.model;

import com.agentforge.orchestrator.model.converter.JsonMapConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit record of one approval decision (approve, reject or timeout).
 * No setters: rows are inserted once and never updated.
 */
@Entity
@Table(name = "approval_actions")
public class ApprovalAction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "request_id", nullable = false, updatable = false)
    private ApprovalRequest request;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ApprovalStatus action;

    @Column(nullable = false, updatable = false)
    private String actor;

    @Column(updatable = false)
    private String comment;

    @Convert(converter = JsonMapConverter.class)
    @Column(updatable = false)
    private Map<String, Object> feedback = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected ApprovalAction() {}   // required by JPA

    ApprovalAction(ApprovalRequest request, ApprovalStatus action, String actor, String comment,
                   Map<String, Object> feedback, Instant createdAt) {
        this.request   = request;
        this.action    = action;
        this.actor     = actor;
        this.comment   = comment;
        this.feedback  = feedback == null ? new LinkedHashMap<>() : new LinkedHashMap<>(feedback);
        this.createdAt = createdAt;
    }

    public UUID            getId()        { return id; }
    public ApprovalRequest getRequest()   { return request; }
    public ApprovalStatus  getAction()    { return action; }
    public String          getActor()     { return actor; }
    public String          getComment()   { return comment; }
    public Map<String, Object> getFeedback() { return feedback; }
    public Instant         getCreatedAt() { return createdAt; }
}
