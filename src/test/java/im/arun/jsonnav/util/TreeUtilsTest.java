package im.arun.jsonnav.util;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.document.DocumentParser;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.model.ChildPage;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.tree.TreeMaterializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TreeUtilsTest {

    private final JsonNavConfig config = new JsonNavConfig();
    private JsonDocument document;
    private TreeMaterializer materializer;
    private LazyNode root;

    @BeforeEach
    void setUp() {
        document = new DocumentParser(config)
            .parse("{\"a\":{\"b\":[10,20]},\"c\":3}".getBytes(StandardCharsets.UTF_8), "utils.json");
        materializer = new TreeMaterializer(config);
        root = materializer.createRoot(document);
        load(root);
    }

    private void load(LazyNode node) {
        node.beginLoading();
        ChildPage page = materializer.materializeChildren(document, node, 0, 100, CancellationSignal.none());
        node.completeLoading(page.getChildren(), page.isPartial());
    }

    @Test
    void visibleNodesFollowOnlyExpandedNodes() {
        LazyNode a = root.getChildren().get(0);
        load(a);

        assertThat(TreeUtils.visibleNodes(root)).extracting(LazyNode::getKey).containsExactly("root");

        root.setExpanded(true);
        assertThat(TreeUtils.visibleNodes(root)).extracting(LazyNode::getKey).containsExactly("root", "a", "c");

        a.setExpanded(true);
        assertThat(TreeUtils.visibleNodes(root)).extracting(LazyNode::getKey).containsExactly("root", "a", "b", "c");
    }

    @Test
    void materializedNodesIgnoreExpansion() {
        LazyNode a = root.getChildren().get(0);
        load(a);
        load(a.getChildren().get(0));

        assertThat(TreeUtils.countMaterialized(root)).isEqualTo(6);
        assertThat(TreeUtils.materializedNodes(root)).extracting(LazyNode::getKey)
            .containsExactly("root", "a", "b", "[0]", "[1]", "c");
    }

    @Test
    void findWalksLoadedChildrenOnly() {
        LazyNode a = root.getChildren().get(0);

        assertThat(TreeUtils.find(root, NodePath.parse("$.a.b"))).isNull();

        load(a);
        load(a.getChildren().get(0));

        assertThat(TreeUtils.find(root, NodePath.parse("$.a.b[1]")).getDisplayValue()).isEqualTo("20");
        assertThat(TreeUtils.find(root, NodePath.root())).isSameAs(root);
        assertThat(TreeUtils.find(root, NodePath.parse("$.zz"))).isNull();
    }
}
