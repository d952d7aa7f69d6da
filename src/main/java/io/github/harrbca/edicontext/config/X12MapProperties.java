package io.github.harrbca.edicontext.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "app.x12")
public class X12MapProperties {

    // file system directory, or classpath:<dir>
    private String mapPath = "classpath:maps";
    private String controlMapFile = "x12.control.00401.xml";
    private String mapIndexFile = "maps.xml";

    // GS08 versions whose transaction map also depends on BHT02
    private List<String> purposeCodeVersions = new ArrayList<>(List.of("004010X094", "004010X094A1"));
}
