package name.nkonev.versionfolders.autoconfigure;

import java.util.Collections;
import java.util.List;
import name.nkonev.versionfolders.core.SqlScript;
import name.nkonev.versionfolders.core.VersionFolders;
import name.nkonev.versionfolders.core.VersionFoldersProperties;
import name.nkonev.versionfolders.reader.SpringVersionFolderReader;
import name.nkonev.versionfolders.reader.VersionFolderReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;

@Configuration
@EnableConfigurationProperties(VersionFoldersAutoConfiguration.SpringBootVersionFoldersProperties.class)
public class VersionFoldersAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(VersionFoldersAutoConfiguration.class);

    @ConfigurationProperties("version-folders")
    public static class SpringBootVersionFoldersProperties extends VersionFoldersProperties {

    }

    public static class VersionFoldersScriptProvider {
        private final VersionFoldersProperties properties;
        private final VersionFolderReader reader;

        public VersionFoldersScriptProvider(VersionFoldersProperties properties, VersionFolderReader reader) {
            this.properties = properties;
            this.reader = reader;
        }

        /**
         * Resolves the scripts anew on every call.
         */
        public List<SqlScript> getScripts() {
            if (!properties.isEnable()) {
                LOGGER.info("Version folders are disabled");
                return Collections.emptyList();
            }
            return VersionFolders.resolve(properties, reader);
        }
    }

    @Bean
    @ConditionalOnMissingBean(VersionFolderReader.class)
    public VersionFolderReader versionFolderReader(ResourceLoader resourceLoader) {
        return new SpringVersionFolderReader(ResourcePatternUtils.getResourcePatternResolver(resourceLoader));
    }

    @Bean
    @ConditionalOnMissingBean(VersionFoldersScriptProvider.class)
    public VersionFoldersScriptProvider versionFoldersScriptProvider(SpringBootVersionFoldersProperties properties,
                                                                     VersionFolderReader versionFolderReader) {
        return new VersionFoldersScriptProvider(properties, versionFolderReader);
    }
}
