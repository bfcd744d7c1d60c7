package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;
import com.starscape.offlineocr.features.ocrjob.domain.Segment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Builds the plain-text export of a job: directly extracted text first, then one block per
 * recognized page in page order.
 */
@Component
public class AggregatedTextComposer {
    
    public String compose(JobSnapshot job) {
        StringBuilder out = new StringBuilder();
        if (job.extractedText() != null && !job.extractedText().isBlank()) {
            out.append(job.extractedText().strip()).append("\n\n");
        }
        
        List<Segment> ordered = job.segments().stream()
                .sorted(Comparator.comparingInt(Segment::pageIndex))
                .toList();
        List<String> blocks = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Segment segment = ordered.get(i);
            blocks.add(String.format(Locale.ROOT, "--- Page %d (Confidence: %.2f%%) ---\n%s\n",
                i + 1, segment.confidence(), segment.text().strip()));
        }
        out.append(String.join("\n", blocks));
        return out.toString();
    }
}
