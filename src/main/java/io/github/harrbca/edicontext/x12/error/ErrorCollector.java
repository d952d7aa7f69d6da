package io.github.harrbca.edicontext.x12.error;

import io.github.harrbca.edicontext.x12.map.MapNode;
import io.github.harrbca.edicontext.x12.model.Segment;
import io.github.harrbca.edicontext.x12.model.ValidationError;
import io.github.harrbca.edicontext.x12.source.SegmentSource;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Getter
public class ErrorCollector implements ErrorSink {

    private final List<InterchangeErrors> interchanges = new ArrayList<>();
    // errors reported outside any interchange
    private final List<ValidationError> unattached = new ArrayList<>();
    private int openNotifications;
    private int closeNotifications;
    private int segmentNotifications;

    @Getter(lombok.AccessLevel.NONE)
    private InterchangeErrors currentIsa;
    @Getter(lombok.AccessLevel.NONE)
    private GroupErrors currentGs;
    @Getter(lombok.AccessLevel.NONE)
    private TransactionErrors currentSt;

    @Override
    public void addIsaLoop(Segment segment, SegmentSource source) {
        openNotifications++;
        currentIsa = new InterchangeErrors(segment.getValue("ISA13"), source.getCurrentLine());
        interchanges.add(currentIsa);
        currentGs = null;
        currentSt = null;
        log.debug("Interchange {} opened at line {}", currentIsa.getControlNumber(), source.getCurrentLine());
    }

    @Override
    public void closeIsaLoop(MapNode node, Segment segment, SegmentSource source) {
        closeNotifications++;
        log.debug("Interchange {} closed at line {}", segment.getValue("IEA02"), source.getCurrentLine());
        currentIsa = null;
        currentGs = null;
        currentSt = null;
    }

    @Override
    public void addGsLoop(Segment segment, SegmentSource source) {
        openNotifications++;
        currentGs = new GroupErrors(segment.getValue("GS06"), segment.getValue("GS01"), source.getCurrentLine());
        if (currentIsa != null) {
            currentIsa.getGroups().add(currentGs);
        }
        currentSt = null;
        log.debug("Group {} ({}) opened at line {}", currentGs.getControlNumber(), currentGs.getFunctionalIdCode(),
                source.getCurrentLine());
    }

    @Override
    public void closeGsLoop(MapNode node, Segment segment, SegmentSource source) {
        closeNotifications++;
        log.debug("Group {} closed at line {}", segment.getValue("GE02"), source.getCurrentLine());
        currentGs = null;
        currentSt = null;
    }

    @Override
    public void addStLoop(Segment segment, SegmentSource source) {
        openNotifications++;
        currentSt = new TransactionErrors(segment.getValue("ST02"), segment.getValue("ST01"), source.getCurrentLine());
        if (currentGs != null) {
            currentGs.getTransactions().add(currentSt);
        }
        log.debug("Transaction set {} ({}) opened at line {}", currentSt.getControlNumber(),
                currentSt.getTransactionSetId(), source.getCurrentLine());
    }

    @Override
    public void closeStLoop(MapNode node, Segment segment, SegmentSource source) {
        closeNotifications++;
        log.debug("Transaction set {} closed at line {}", segment.getValue("SE02"), source.getCurrentLine());
        currentSt = null;
    }

    @Override
    public void addSegment(MapNode node, Segment segment, int segmentCount, int line, String loopRepeatId) {
        segmentNotifications++;
        if (currentSt != null) {
            currentSt.segmentCount++;
        }
        log.trace("Segment {} #{} at line {} -> {}", segment.getSegmentId(), segmentCount, line, node.getPath());
    }

    @Override
    public void handleErrors(List<ValidationError> errors) {
        for (ValidationError error : errors) {
            log.warn("Validation error {}", error.getFormattedMessage());
            target(error).add(error);
        }
    }

    public int getNotificationCount() {
        return openNotifications + closeNotifications;
    }

    public List<ValidationError> getAllErrors() {
        List<ValidationError> all = new ArrayList<>(unattached);
        for (InterchangeErrors isa : interchanges) {
            all.addAll(isa.getErrors());
            for (GroupErrors gs : isa.getGroups()) {
                all.addAll(gs.getErrors());
                for (TransactionErrors st : gs.getTransactions()) {
                    all.addAll(st.getErrors());
                }
            }
        }
        return all;
    }

    public int getErrorCount() {
        return getAllErrors().size();
    }

    private List<ValidationError> target(ValidationError error) {
        switch (error.getScope()) {
            case ISA:
                break;
            case GS:
                if (currentGs != null) return currentGs.getErrors();
                break;
            default:
                if (currentSt != null) return currentSt.getErrors();
                if (currentGs != null) return currentGs.getErrors();
                break;
        }
        return currentIsa != null ? currentIsa.getErrors() : unattached;
    }

    @Getter
    @RequiredArgsConstructor
    public static class InterchangeErrors {
        private final String controlNumber;
        private final int line;
        private final List<GroupErrors> groups = new ArrayList<>();
        private final List<ValidationError> errors = new ArrayList<>();
    }

    @Getter
    @RequiredArgsConstructor
    public static class GroupErrors {
        private final String controlNumber;
        private final String functionalIdCode;
        private final int line;
        private final List<TransactionErrors> transactions = new ArrayList<>();
        private final List<ValidationError> errors = new ArrayList<>();
    }

    @Getter
    @RequiredArgsConstructor
    public static class TransactionErrors {
        private final String controlNumber;
        private final String transactionSetId;
        private final int line;
        private int segmentCount;
        private final List<ValidationError> errors = new ArrayList<>();
    }
}
