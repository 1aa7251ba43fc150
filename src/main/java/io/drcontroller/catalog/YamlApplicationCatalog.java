package io.drcontroller.catalog;

import io.drcontroller.models.Application;
import io.drcontroller.models.Qtree;
import io.drcontroller.models.Share;
import io.drcontroller.models.Volume;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads applications from the SnapMirror input YAML:
 *
 * <pre>
 * - app_name: APP1
 *   prod_cluster: prod-netapp.company.com
 *   dr_cluster: dr-netapp.company.com
 *   prod_vserver: prod_svm
 *   dr_vserver: dr_svm
 *   details: "..."
 *   volume_names:
 *     - volume_name: app1_vol1
 *       qtrees:
 *         - qtree_name: qtree1
 *           share_name: APP1_SHARE1
 *     - volume_name: app1_vol2
 *       share_name: APP1_SHARE2
 * </pre>
 *
 * Every problem in the file is collected and reported at once; a malformed file never
 * yields a partial catalog.
 */
@Slf4j
public class YamlApplicationCatalog implements ApplicationCatalog {

    private final List<Application> applications;

    public YamlApplicationCatalog(Path file) {
        this(file.toString(), open(file));
    }

    public YamlApplicationCatalog(String source, InputStream inputStream) {
        try (InputStream in = inputStream) {
            this.applications = Collections.unmodifiableList(parse(source, in));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read application configuration " + source, e);
        }
        log.info("Loaded {} applications from {}", applications.size(), source);
    }

    @Override
    public List<Application> getApplications() {
        return applications;
    }

    @Override
    public Optional<Application> findApplication(String name) {
        return applications.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    private static InputStream open(Path file) {
        try {
            return Files.newInputStream(file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot open application configuration " + file + ": " + e.getMessage(), e);
        }
    }

    private static List<Application> parse(String source, InputStream in) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML in " + source + ": " + e.getMessage(), e);
        }
        if (!(document instanceof List)) {
            throw new ConfigurationException(source, List.of("top level must be a list of applications"));
        }

        List<String> problems = new ArrayList<>();
        List<Application> result = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (Object entry : (List<?>) document) {
            String where = "application #" + (++index);
            if (!(entry instanceof Map)) {
                problems.add(where + ": must be a mapping");
                continue;
            }
            Application application = parseApplication((Map<?, ?>) entry, where, problems);
            if (application == null) {
                continue;
            }
            if (!names.add(application.getName())) {
                problems.add(where + ": duplicate app_name '" + application.getName() + "'");
                continue;
            }
            result.add(application);
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(source, problems);
        }
        return result;
    }

    private static Application parseApplication(Map<?, ?> map, String where, List<String> problems) {
        int before = problems.size();
        String name = requiredString(map, "app_name", where, problems);
        if (name != null) {
            where = "application '" + name + "'";
        }
        String prodCluster = requiredString(map, "prod_cluster", where, problems);
        String drCluster = requiredString(map, "dr_cluster", where, problems);
        String prodVserver = requiredString(map, "prod_vserver", where, problems);
        String drVserver = requiredString(map, "dr_vserver", where, problems);
        Object details = map.get("details");

        List<Volume> volumes = new ArrayList<>();
        Object rawVolumes = map.get("volume_names");
        if (!(rawVolumes instanceof List) || ((List<?>) rawVolumes).isEmpty()) {
            problems.add(where + ": volume_names must be a non-empty list");
        } else {
            Set<String> volumeNames = new HashSet<>();
            for (Object rawVolume : (List<?>) rawVolumes) {
                Volume volume = parseVolume(rawVolume, where, problems);
                if (volume != null && !volumeNames.add(volume.getName())) {
                    problems.add(where + ": duplicate volume_name '" + volume.getName() + "'");
                } else if (volume != null) {
                    volumes.add(volume);
                }
            }
        }

        if (problems.size() > before) {
            return null;
        }
        return Application.builder()
            .name(name)
            .prodCluster(prodCluster)
            .drCluster(drCluster)
            .prodVserver(prodVserver)
            .drVserver(drVserver)
            .details(details != null ? details.toString() : null)
            .volumes(Collections.unmodifiableList(volumes))
            .build();
    }

    private static Volume parseVolume(Object raw, String where, List<String> problems) {
        if (!(raw instanceof Map)) {
            problems.add(where + ": volume entries must be mappings");
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) raw;
        String name = requiredString(map, "volume_name", where, problems);
        if (name == null) {
            return null;
        }
        String volumeWhere = where + " volume '" + name + "'";
        Object shareName = map.get("share_name");
        Object rawQtrees = map.get("qtrees");
        if (shareName != null && rawQtrees != null) {
            problems.add(volumeWhere + ": share_name and qtrees are mutually exclusive");
            return null;
        }

        Volume volume = new Volume(name);
        if (shareName != null) {
            volume.setShare(new Share(shareName.toString(), "/" + name));
        }
        if (rawQtrees != null) {
            if (!(rawQtrees instanceof List)) {
                problems.add(volumeWhere + ": qtrees must be a list");
                return null;
            }
            for (Object rawQtree : (List<?>) rawQtrees) {
                if (!(rawQtree instanceof Map)) {
                    problems.add(volumeWhere + ": qtree entries must be mappings");
                    continue;
                }
                Map<?, ?> qtreeMap = (Map<?, ?>) rawQtree;
                String qtreeName = requiredString(qtreeMap, "qtree_name", volumeWhere, problems);
                if (qtreeName == null) {
                    continue;
                }
                Object qtreeShare = qtreeMap.get("share_name");
                Share share = qtreeShare != null
                    ? new Share(qtreeShare.toString(), "/" + name + "/" + qtreeName)
                    : null;
                volume.getQtrees().add(new Qtree(qtreeName, share));
            }
        }
        return volume;
    }

    private static String requiredString(Map<?, ?> map, String key, String where, List<String> problems) {
        Object value = map.get(key);
        if (value == null || value.toString().isBlank()) {
            problems.add(where + ": missing " + key);
            return null;
        }
        return value.toString().trim();
    }
}
