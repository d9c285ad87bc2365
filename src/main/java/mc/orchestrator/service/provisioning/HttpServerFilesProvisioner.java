package mc.orchestrator.service.provisioning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Downloads server jars and installers from the upstream project APIs.
 */
@Slf4j
public class HttpServerFilesProvisioner implements ServerFilesProvisioner {
    private static final String MOJANG_MANIFEST_URL = "https://piston-meta.mojang.com/mc/game/version_manifest_v2.json";
    private static final String PAPER_API_URL = "https://api.papermc.io/v2/projects/paper";
    private static final String PURPUR_API_URL = "https://api.purpurmc.org/v2/purpur";
    private static final String FABRIC_META_URL = "https://meta.fabricmc.net/v2/versions";
    private static final String FORGE_PROMOTIONS_URL = "https://files.minecraftforge.net/net/minecraftforge/forge/promotions_slim.json";
    private static final String FORGE_MAVEN_URL = "https://maven.minecraftforge.net/net/minecraftforge/forge";
    private static final String NEOFORGE_MAVEN_URL = "https://maven.neoforged.net/releases/net/neoforged/neoforge";
    private static final Pattern MAVEN_VERSION_PATTERN = Pattern.compile("<version>([^<]+)</version>");

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration downloadTimeout;

    public HttpServerFilesProvisioner(ObjectMapper objectMapper, Duration connectTimeout, Duration downloadTimeout) {
        this.objectMapper = objectMapper;
        this.downloadTimeout = downloadTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .build();
    }

    @Override
    public void prepareFiles(String type, String version, Path dir, String loaderVersion, String installerVersion)
            throws IOException {
        Files.createDirectories(dir);
        String normalized = type == null ? "" : type.toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "vanilla" -> download(resolveVanillaUrl(version), dir.resolve(ArtifactValidator.SERVER_JAR));
            case "paper" -> download(resolvePaperUrl(version), dir.resolve(ArtifactValidator.SERVER_JAR));
            case "purpur" -> download(resolvePurpurUrl(version), dir.resolve(ArtifactValidator.SERVER_JAR));
            case "fabric" -> download(resolveFabricUrl(version, loaderVersion, installerVersion),
                    dir.resolve(ArtifactValidator.SERVER_JAR));
            case "forge" -> {
                String forgeVersion = loaderVersion != null && !loaderVersion.isBlank()
                        ? loaderVersion : resolveForgeVersion(version);
                String full = version + "-" + forgeVersion;
                download(FORGE_MAVEN_URL + "/" + full + "/forge-" + full + "-installer.jar",
                        dir.resolve("forge-" + full + "-installer.jar"));
            }
            case "neoforge" -> {
                String neoVersion = loaderVersion != null && !loaderVersion.isBlank()
                        ? loaderVersion : resolveNeoForgeVersion(version);
                download(NEOFORGE_MAVEN_URL + "/" + neoVersion + "/neoforge-" + neoVersion + "-installer.jar",
                        dir.resolve("neoforge-" + neoVersion + "-installer.jar"));
            }
            default -> throw new IOException("Unsupported server type: " + type);
        }
        Files.writeString(dir.resolve("eula.txt"), "eula=true\n");
    }

    String resolveVanillaUrl(String version) throws IOException {
        JsonNode manifest = getJson(MOJANG_MANIFEST_URL);
        for (JsonNode entry : manifest.path("versions")) {
            if (version.equals(entry.path("id").asText())) {
                JsonNode details = getJson(entry.path("url").asText());
                String url = details.path("downloads").path("server").path("url").asText(null);
                if (url != null) {
                    return url;
                }
                break;
            }
        }
        throw new IOException("No vanilla server download for version " + version);
    }

    String resolvePaperUrl(String version) throws IOException {
        JsonNode builds = getJson(PAPER_API_URL + "/versions/" + version + "/builds").path("builds");
        if (!builds.isArray() || builds.isEmpty()) {
            throw new IOException("No Paper builds for version " + version);
        }
        String build = builds.get(builds.size() - 1).path("build").asText();
        return String.format("%s/versions/%s/builds/%s/downloads/paper-%s-%s.jar",
                PAPER_API_URL, version, build, version, build);
    }

    String resolvePurpurUrl(String version) throws IOException {
        JsonNode builds = getJson(PURPUR_API_URL + "/" + version).path("builds");
        String latest;
        if (builds.isArray() && !builds.isEmpty()) {
            latest = builds.get(builds.size() - 1).asText();
        } else {
            latest = builds.path("latest").asText(null);
        }
        if (latest == null || latest.isBlank()) {
            throw new IOException("No Purpur builds for version " + version);
        }
        return PURPUR_API_URL + "/" + version + "/" + latest + "/download";
    }

    String resolveFabricUrl(String version, String loaderVersion, String installerVersion) throws IOException {
        String loader = loaderVersion;
        if (loader == null || loader.isBlank()) {
            JsonNode loaders = getJson(FABRIC_META_URL + "/loader/" + version);
            if (!loaders.isArray() || loaders.isEmpty()) {
                throw new IOException("No Fabric loader for version " + version);
            }
            loader = loaders.get(0).path("loader").path("version").asText();
        }
        String installer = installerVersion;
        if (installer == null || installer.isBlank()) {
            JsonNode installers = getJson(FABRIC_META_URL + "/installer");
            if (!installers.isArray() || installers.isEmpty()) {
                throw new IOException("No Fabric installer versions available");
            }
            installer = installers.get(0).path("version").asText();
        }
        return FABRIC_META_URL + "/loader/" + version + "/" + loader + "/" + installer + "/server/jar";
    }

    String resolveForgeVersion(String version) throws IOException {
        JsonNode promos = getJson(FORGE_PROMOTIONS_URL).path("promos");
        String forgeVersion = promos.path(version + "-latest").asText(null);
        if (forgeVersion == null) {
            forgeVersion = promos.path(version + "-recommended").asText(null);
        }
        if (forgeVersion == null) {
            throw new IOException("No Forge build promoted for version " + version);
        }
        return forgeVersion;
    }

    String resolveNeoForgeVersion(String version) throws IOException {
        String metadata = getString(NEOFORGE_MAVEN_URL + "/maven-metadata.xml");
        String prefix = neoForgePrefix(version);
        List<String> versions = new ArrayList<>();
        Matcher m = MAVEN_VERSION_PATTERN.matcher(metadata);
        while (m.find()) {
            versions.add(m.group(1));
        }
        for (int i = versions.size() - 1; i >= 0; i--) {
            if (versions.get(i).startsWith(prefix)) {
                return versions.get(i);
            }
        }
        throw new IOException("No NeoForge build for version " + version);
    }

    /**
     * NeoForge drops the leading "1." of the game version: 1.20.4 maps to 20.4.x, 1.21 to 21.0.x.
     */
    static String neoForgePrefix(String version) {
        String trimmed = version.startsWith("1.") ? version.substring(2) : version;
        String[] parts = trimmed.split("\\.");
        String minor = parts.length > 1 ? parts[1] : "0";
        return parts[0] + "." + minor + ".";
    }

    private void download(String url, Path destination) throws IOException {
        log.info("Downloading {} to {}", url, destination);
        Path tmp = destination.resolveSibling(destination.getFileName() + ".part");
        HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(downloadTimeout).GET().build();
        try {
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(tmp));
            if (response.statusCode() != 200) {
                Files.deleteIfExists(tmp);
                throw new IOException("Download of " + url + " failed with HTTP " + response.statusCode());
            }
            Files.move(tmp, destination, StandardCopyOption.REPLACE_EXISTING);
            log.info("Successfully downloaded {} ({} bytes)", destination, Files.size(destination));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Files.deleteIfExists(tmp);
            throw new IOException("Download of " + url + " interrupted", e);
        }
    }

    private JsonNode getJson(String url) throws IOException {
        return objectMapper.readTree(getString(url));
    }

    private String getString(String url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(Duration.ofSeconds(30)).GET().build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("GET " + url + " returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("GET " + url + " interrupted", e);
        }
    }
}
