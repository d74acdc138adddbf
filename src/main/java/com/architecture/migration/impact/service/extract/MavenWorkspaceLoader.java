package com.architecture.migration.impact.service.extract;

import com.architecture.migration.impact.dto.extract.PackageDescriptor;
import com.architecture.migration.impact.dto.extract.ProjectDescriptor;
import com.architecture.migration.impact.dto.extract.SolutionDescriptor;
import com.architecture.migration.impact.model.graph.nodes.ProjectKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads Maven workspaces. An aggregator pom (packaging {@code pom} with modules) is a
 * solution whose nested modules are flattened into projects; any other pom is a single
 * project wrapped in a virtual solution.
 *
 * A dependency on a sibling module becomes a project reference, every other dependency an
 * external package named {@code groupId:artifactId}.
 */
@Component
@Slf4j
public class MavenWorkspaceLoader implements WorkspaceLoader {

    static final String POM_FILE = "pom.xml";

    private static final Set<String> TRACKED_EXTENSIONS = Set.of(
            ".java", ".xml", ".fxml", ".html", ".properties", ".yml", ".yaml", ".json");
    private static final Pattern PROPERTY_REFERENCE = Pattern.compile("\\$\\{([^}]+)}");

    @Override
    public SolutionDescriptor load(Path inputPath) throws IOException {
        Path rootPom = Files.isDirectory(inputPath) ? inputPath.resolve(POM_FILE) : inputPath;
        if (!Files.isRegularFile(rootPom)) {
            throw new NoSuchFileException(rootPom.toString(), null, "No pom.xml found");
        }
        rootPom = rootPom.toAbsolutePath().normalize();
        PomInfo root = parsePom(rootPom, null);

        List<PomInfo> modules = new ArrayList<>();
        boolean aggregator = root.isAggregator();
        if (aggregator) {
            collectModules(root, modules, new HashSet<>());
        } else {
            modules.add(root);
        }

        Map<String, PomInfo> byCoordinate = new LinkedHashMap<>();
        for (PomInfo module : modules) {
            byCoordinate.putIfAbsent(module.coordinate(), module);
        }

        List<ProjectDescriptor> projects = modules.stream()
                .map(module -> toProject(module, byCoordinate))
                .collect(Collectors.toList());

        log.info("Loaded Maven workspace {} with {} project(s)", rootPom, projects.size());
        return SolutionDescriptor.builder()
                .path(rootPom.toString())
                .name(root.artifactId)
                .virtual(!aggregator)
                .projects(projects)
                .build();
    }

    // ========================= MODULES =========================

    private void collectModules(PomInfo aggregator, List<PomInfo> result, Set<Path> seen) {
        if (!seen.add(aggregator.path)) {
            return;
        }
        Path baseDir = aggregator.path.getParent();
        for (String module : aggregator.modules) {
            Path modulePom = baseDir.resolve(module);
            if (Files.isDirectory(modulePom)) {
                modulePom = modulePom.resolve(POM_FILE);
            }
            modulePom = modulePom.toAbsolutePath().normalize();
            if (!Files.isRegularFile(modulePom)) {
                log.warn("Module {} of {} has no pom.xml, skipping", module, aggregator.path);
                continue;
            }
            PomInfo child;
            try {
                child = parsePom(modulePom, aggregator);
            } catch (IOException e) {
                log.warn("Cannot read module pom {}: {}", modulePom, e.getMessage());
                continue;
            }
            if (child.isAggregator()) {
                collectModules(child, result, seen);
            } else if (seen.add(child.path)) {
                result.add(child);
            }
        }
    }

    private ProjectDescriptor toProject(PomInfo pom, Map<String, PomInfo> byCoordinate) {
        List<String> projectReferences = new ArrayList<>();
        List<PackageDescriptor> packages = new ArrayList<>();
        for (Dependency dependency : pom.dependencies) {
            PomInfo sibling = byCoordinate.get(dependency.coordinate());
            if (sibling != null && sibling != pom) {
                projectReferences.add(sibling.path.toString());
            } else if (sibling == null) {
                packages.add(PackageDescriptor.builder()
                        .packageId(dependency.coordinate())
                        .version(dependency.version)
                        .build());
            }
        }

        return ProjectDescriptor.builder()
                .path(pom.path.toString())
                .name(pom.artifactId)
                .rootNamespace(pom.groupId)
                .targetFramework(targetRelease(pom))
                .kind(classify(pom))
                .projectReferences(projectReferences)
                .packageReferences(packages)
                .files(listFiles(pom.path.getParent()))
                .build();
    }

    private String targetRelease(PomInfo pom) {
        for (String key : List.of("maven.compiler.release", "maven.compiler.source", "java.version")) {
            String value = pom.property(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Classify a module from its name, packaging and dependencies.
     */
    private ProjectKind classify(PomInfo pom) {
        String name = pom.artifactId.toLowerCase(Locale.ROOT);
        if (name.endsWith("-test") || name.endsWith("-tests") || name.contains("integration-test")) {
            return ProjectKind.TEST;
        }
        Set<String> artifacts = pom.dependencies.stream().map(d -> d.artifactId).collect(Collectors.toSet());
        if ("war".equals(pom.packaging)
                || artifacts.contains("spring-boot-starter-web")
                || artifacts.contains("spring-boot-starter-webflux")
                || artifacts.contains("jakarta.ws.rs-api")) {
            return ProjectKind.WEB_API;
        }
        if (artifacts.stream().anyMatch(a -> a.startsWith("javafx-"))) {
            return ProjectKind.GUI;
        }
        if (pom.plugins.contains("spring-boot-maven-plugin") || pom.plugins.contains("exec-maven-plugin")) {
            return ProjectKind.EXECUTABLE;
        }
        if ("jar".equals(pom.packaging) || pom.packaging == null) {
            return ProjectKind.LIBRARY;
        }
        return ProjectKind.OTHER;
    }

    private List<String> listFiles(Path moduleDir) {
        Path sourceRoot = moduleDir.resolve("src");
        Path walkRoot = Files.isDirectory(sourceRoot) ? sourceRoot : moduleDir;
        try (Stream<Path> paths = Files.walk(walkRoot)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> !walkRoot.relativize(p).startsWith("target"))
                    .filter(this::isTracked)
                    .map(p -> p.toAbsolutePath().normalize().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list files under {}: {}", walkRoot, e.getMessage());
            return new ArrayList<>();
        }
    }

    private boolean isTracked(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.equals(POM_FILE)) {
            return false;
        }
        return TRACKED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    // ========================= POM PARSING =========================

    private PomInfo parsePom(Path pomPath, PomInfo parent) throws IOException {
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            document = builder.parse(pomPath.toFile());
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Invalid pom " + pomPath + ": " + e.getMessage(), e);
        }
        document.getDocumentElement().normalize();
        Element project = document.getDocumentElement();

        PomInfo pom = new PomInfo(pomPath, parent);
        Element parentElement = findDirectChild(project, "parent");
        pom.groupId = textOfDirectChild(project, "groupId");
        if (pom.groupId == null && parentElement != null) {
            pom.groupId = textOfDirectChild(parentElement, "groupId");
        }
        if (pom.groupId == null && parent != null) {
            pom.groupId = parent.groupId;
        }
        pom.artifactId = textOfDirectChild(project, "artifactId");
        if (pom.artifactId == null) {
            pom.artifactId = pomPath.getParent().getFileName().toString();
        }
        pom.packaging = textOfDirectChild(project, "packaging");

        Element properties = findDirectChild(project, "properties");
        if (properties != null) {
            for (Element property : childElements(properties)) {
                pom.properties.put(localName(property), property.getTextContent().trim());
            }
        }
        pom.properties.putIfAbsent("project.groupId", pom.groupId == null ? "" : pom.groupId);

        Element modules = findDirectChild(project, "modules");
        if (modules != null) {
            for (Element module : childElements(modules)) {
                if (matchesName(module, "module")) {
                    pom.modules.add(module.getTextContent().trim());
                }
            }
        }

        Element dependencies = findDirectChild(project, "dependencies");
        if (dependencies != null) {
            for (Element dependency : childElements(dependencies)) {
                if (!matchesName(dependency, "dependency")) {
                    continue;
                }
                String groupId = pom.resolve(textOfDirectChild(dependency, "groupId"));
                String artifactId = pom.resolve(textOfDirectChild(dependency, "artifactId"));
                if (groupId == null || artifactId == null) {
                    log.debug("Ignoring dependency without coordinates in {}", pomPath);
                    continue;
                }
                pom.dependencies.add(new Dependency(groupId, artifactId,
                        pom.resolve(textOfDirectChild(dependency, "version"))));
            }
        }

        Element build = findDirectChild(project, "build");
        Element plugins = build == null ? null : findDirectChild(build, "plugins");
        if (plugins != null) {
            for (Element plugin : childElements(plugins)) {
                String artifactId = textOfDirectChild(plugin, "artifactId");
                if (artifactId != null) {
                    pom.plugins.add(artifactId);
                }
            }
        }
        return pom;
    }

    private Element findDirectChild(Element parent, String name) {
        for (Element child : childElements(parent)) {
            if (matchesName(child, name)) {
                return child;
            }
        }
        return null;
    }

    private List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node instanceof Element) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private boolean matchesName(Node node, String name) {
        return name.equals(localName(node));
    }

    private String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private String textOfDirectChild(Element parent, String name) {
        Element child = findDirectChild(parent, name);
        if (child == null) {
            return null;
        }
        String text = child.getTextContent().trim();
        return text.isEmpty() ? null : text;
    }

    // ========================= POM MODEL =========================

    private record Dependency(String groupId, String artifactId, String version) {

        String coordinate() {
            return groupId + ":" + artifactId;
        }
    }

    static final class PomInfo {

        private final Path path;
        private final PomInfo parent;
        private String groupId;
        private String artifactId;
        private String packaging;
        private final Map<String, String> properties = new HashMap<>();
        private final List<String> modules = new ArrayList<>();
        private final List<Dependency> dependencies = new ArrayList<>();
        private final Set<String> plugins = new HashSet<>();

        private PomInfo(Path path, PomInfo parent) {
            this.path = path;
            this.parent = parent;
        }

        boolean isAggregator() {
            return "pom".equals(packaging) && !modules.isEmpty();
        }

        String coordinate() {
            return groupId + ":" + artifactId;
        }

        /**
         * A property of this pom or, failing that, of the aggregator that declared it.
         */
        String property(String key) {
            String value = properties.get(key);
            if (value == null && parent != null) {
                return parent.property(key);
            }
            return value;
        }

        /**
         * Substitute {@code ${...}} references. Unknown properties are left as written.
         */
        String resolve(String value) {
            if (value == null || !value.contains("${")) {
                return value;
            }
            Matcher matcher = PROPERTY_REFERENCE.matcher(value);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String replacement = property(matcher.group(1));
                matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
            }
            matcher.appendTail(sb);
            return sb.toString();
        }
    }
}
