package com.demo.triage;

import com.demo.triage.domain.InboundMessage;
import com.demo.triage.domain.IngestionResult;
import com.demo.triage.domain.Issue;
import com.demo.triage.domain.MatchDecision;
import com.demo.triage.domain.Message;
import com.demo.triage.exception.IssueIntegrityException;
import com.demo.triage.infrastructure.IssueStore;
import com.demo.triage.service.IngestionCoordinator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TriageServerApplicationTests {

    @Autowired
    private IngestionCoordinator coordinator;

    @Autowired
    private IssueStore issueStore;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("ingest, cluster and resolve against the JPA store")
    void ingestClusterResolve() throws Exception {
        IngestionResult login = coordinator.ingest(inbound("C-ctx:1", "error: login page crashes on submit"));
        IngestionResult darkMode = coordinator.ingest(inbound("C-ctx:2", "feature request: add dark mode toggle"));
        IngestionResult loginAgain = coordinator.ingest(inbound("C-ctx:3", "error: login page crashes on submit again"));
        IngestionResult lunch = coordinator.ingest(inbound("C-ctx:4", "anyone want lunch?"));

        assertThat(login.getOutcome()).isEqualTo(IngestionResult.Outcome.CLUSTERED);
        assertThat(login.getMatchOutcome()).isEqualTo(MatchDecision.Outcome.CREATED);
        assertThat(darkMode.getIssueId()).isNotEqualTo(login.getIssueId());
        assertThat(loginAgain.getIssueId()).isEqualTo(login.getIssueId());
        assertThat(loginAgain.getMatchOutcome()).isEqualTo(MatchDecision.Outcome.ATTACHED);
        assertThat(lunch.getOutcome()).isEqualTo(IngestionResult.Outcome.IRRELEVANT);

        Issue loginIssue = issueStore.getIssue(login.getIssueId()).orElseThrow();
        assertThat(loginIssue.getMemberCount()).isEqualTo(2);
        List<Message> members = issueStore.listMessages(login.getIssueId());
        assertThat(members).extracting(Message::getSourceRef).containsExactly("C-ctx:1", "C-ctx:3");

        IngestionResult replay = coordinator.ingest(inbound("C-ctx:3", "error: login page crashes on submit again"));
        assertThat(replay.getOutcome()).isEqualTo(IngestionResult.Outcome.DUPLICATE);
        assertThat(issueStore.getIssue(login.getIssueId()).orElseThrow().getMemberCount()).isEqualTo(2);

        Issue resolved = coordinator.resolve(login.getIssueId());
        assertThat(resolved.getStatus()).isEqualTo(Issue.IssueStatus.RESOLVED);
        assertThat(resolved.getResolvedAt()).isNotNull();

        mockMvc.perform(get("/api/issues/" + login.getIssueId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("resolved"))
                .andExpect(jsonPath("$.member_count").value(2));
    }

    @Test
    @DisplayName("the JPA store refuses to revert a clustered message")
    void staleWriteRefused() {
        IngestionResult done = coordinator.ingest(inbound("C-ctx:10", "error: export crashes on large files"));
        Message stale = issueStore.findMessage(done.getMessageId()).orElseThrow().toBuilder()
                .issueId(null)
                .status(Message.ProcessingStatus.PENDING)
                .build();

        assertThatThrownBy(() -> issueStore.saveMessage(stale)).isInstanceOf(IssueIntegrityException.class);

        Message stored = issueStore.findMessage(done.getMessageId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(Message.ProcessingStatus.CLUSTERED);
        assertThat(stored.getIssueId()).isEqualTo(done.getIssueId());
    }

    @Test
    @DisplayName("health endpoint reports the local collaborators")
    void health() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("connected"))
                .andExpect(jsonPath("$.redis").value("disabled"))
                .andExpect(jsonPath("$.classifier.mode").value("keyword"));
    }

    private static InboundMessage inbound(String sourceRef, String text) {
        return InboundMessage.builder()
                .sourceRef(sourceRef)
                .authorRef("U-ctx")
                .text(text)
                .build();
    }
}
