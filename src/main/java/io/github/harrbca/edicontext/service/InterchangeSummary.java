package io.github.harrbca.edicontext.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InterchangeSummary {
    String fileName;
    String senderId;
    String receiverId;
    String interchangeControlNumber;
    @Singular
    List<String> transactionSetIds;
    int segmentCount;
    String loopId;
    int loopOccurrences;
    @Singular
    List<String> errorMessages;

    public int getErrorCount() {
        return errorMessages.size();
    }

    public boolean hasErrors() {
        return !errorMessages.isEmpty();
    }
}
