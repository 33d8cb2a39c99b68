package io.quorum.core.consensus;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/// Jaccard index over lowercase alphanumeric tokens.
///
/// `"Missing null check on user"` and `"missing null-check for user"` share
/// `missing`, `null`, `check`, `user` out of six distinct tokens.
public class TokenJaccardSimilarity implements FindingSimilarity {

    @Override
    public double similarity(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }

    static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
