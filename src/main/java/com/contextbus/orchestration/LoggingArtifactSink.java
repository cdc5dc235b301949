package com.contextbus.orchestration;

import com.contextbus.scheduler.HaltReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingArtifactSink implements ArtifactSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingArtifactSink.class);

    @Override
    public void onArtifact(String sessionId, Artifact artifact) {
        log.info("Artifact ready for session={} job={}: {} claim(s), {} caveat(s), decisions={}",
            sessionId, artifact.jobKey(), artifact.claims().size(), artifact.caveats().size(),
            artifact.decisions().stream().map(d -> d.scorerId() + "=" + d.decision()).toList());
    }

    @Override
    public void onHalt(String sessionId, HaltReason reason) {
        log.info("Session={} halted in phase {}: {} {}", sessionId, reason.phase(), reason.cause(),
            reason.unmetConditions());
    }
}
