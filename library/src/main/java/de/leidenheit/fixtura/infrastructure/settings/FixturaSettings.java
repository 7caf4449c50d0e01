package de.leidenheit.fixtura.infrastructure.settings;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FixturaSettings {
    // one line per test instead of a progress glyph
    private boolean verbose;
    // no local variable dump on failure
    private boolean quiet;
    @JsonAlias("fail-fast")
    private boolean failFast;
    @JsonAlias("drop-into-debugger")
    private boolean dropIntoDebugger;
    @JsonAlias("analyze-assertions")
    private boolean analyzeAssertions;
    @Builder.Default
    @JsonAlias("source-roots")
    private List<String> sourceRoots = new ArrayList<>();
    @Builder.Default
    private List<String> plugins = new ArrayList<>();

    public static FixturaSettings ofDefault() {
        return FixturaSettings.builder()
                .verbose(false)
                .quiet(false)
                .failFast(false)
                .dropIntoDebugger(false)
                .analyzeAssertions(false)
                .build();
    }
}
