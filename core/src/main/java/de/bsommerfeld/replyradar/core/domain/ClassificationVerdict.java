package de.bsommerfeld.replyradar.core.domain;

import com.google.common.base.Strings;

/**
 * One entry of a classifier response. Ephemeral; never persisted.
 *
 * @param index      position of the judged item inside its chunk
 * @param relevant   whether the item is worth a reply
 * @param reason     short justification from the model
 * @param replyDraft suggested reply, empty for irrelevant items
 */
public record ClassificationVerdict(int index, boolean relevant, String reason, String replyDraft) {

    public ClassificationVerdict {
        reason = Strings.nullToEmpty(reason);
        replyDraft = Strings.nullToEmpty(replyDraft);
    }
}
