package org.lexcrawl.identity;

import org.jetbrains.annotations.Nullable;

/**
 * Picks the subject with the most keyword hits. Title hits weigh three times as much as body hits; ties go to
 * the subject declared first. Without any hit the subject is {@link SubjectCode#GEN}.
 */
public class SubjectClassifier {
    private static final int TITLE_WEIGHT = 3;
    private static final int BODY_LIMIT = 5000;

    public SubjectCode classify(String title, @Nullable String body) {
        String bodyHead = body == null ? "" : body.substring(0, Math.min(body.length(), BODY_LIMIT));
        SubjectCode best = SubjectCode.GEN;
        int bestScore = 0;
        for (SubjectCode subject : SubjectCode.values()) {
            int score = subject.hits(title) * TITLE_WEIGHT + subject.hits(bodyHead);
            if (score > bestScore) {
                best = subject;
                bestScore = score;
            }
        }
        return best;
    }
}
