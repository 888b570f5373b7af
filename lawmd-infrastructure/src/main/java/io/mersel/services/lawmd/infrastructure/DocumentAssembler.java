package io.mersel.services.lawmd.infrastructure;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Madde bloklarını başlık ve dönüşüm zaman damgasıyla tek belgede birleştirir.
 */
@Component
public class DocumentAssembler {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public String assemble(String codeName, LocalDateTime generatedAt, List<String> articleBlocks) {
        var lines = new ArrayList<String>(articleBlocks.size() + 4);
        lines.add("# " + codeName);
        lines.add("");
        lines.add("*Converted from XML on " + TIMESTAMP.format(generatedAt) + "*");
        lines.add("");
        lines.addAll(articleBlocks);
        return String.join("\n", lines);
    }
}
