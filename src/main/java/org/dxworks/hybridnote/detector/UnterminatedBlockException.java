package org.dxworks.hybridnote.detector;

public class UnterminatedBlockException extends RuntimeException {

    private final DetectionRecoveryNotice notice;

    public UnterminatedBlockException(DetectionRecoveryNotice notice) {
        super(notice.getMessage());
        this.notice = notice;
    }

    public DetectionRecoveryNotice getNotice() {
        return notice;
    }
}
