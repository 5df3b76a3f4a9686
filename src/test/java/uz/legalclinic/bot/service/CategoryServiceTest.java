package uz.legalclinic.bot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uz.legalclinic.bot.DbFixture;
import uz.legalclinic.bot.model.Category;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategoryServiceTest {

    @TempDir
    Path dir;

    private DbFixture fx;
    private CategoryService categories;

    @BeforeEach
    void setUp() throws Exception {
        fx = DbFixture.create(dir);
        categories = fx.categories;
    }

    @Test
    void createsAndListsByName() {
        categories.createCategory("  Labour ", "#labour");
        categories.createCategory("Family", "#family");

        assertThat(categories.listCategories()).extracting(c -> c.name).containsExactly("Family", "Labour");
        assertThat(categories.findByName("Labour")).map(Category::label).contains("Labour #labour");
    }

    @Test
    void rejectsDuplicateNames() {
        categories.createCategory("Family", "#family");

        assertThatThrownBy(() -> categories.createCategory("Family", "#other"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).reason())
                .isEqualTo("category_exists");
    }

    @Test
    void validatesNameAndHashtag() {
        assertThatThrownBy(() -> categories.createCategory("F", "#f"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).reason())
                .isEqualTo("category_name_too_short");
        assertThatThrownBy(() -> categories.createCategory("Family", "family"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).reason())
                .isEqualTo("invalid_hashtag");
        assertThatThrownBy(() -> categories.createCategory("Family", "#two words"))
                .isInstanceOf(ValidationException.class);
        assertThat(categories.listCategories()).isEmpty();
    }

    @Test
    void renameKeepsIdAndRefusesTakenName() {
        Category family = categories.createCategory("Family", "#family");
        categories.createCategory("Labour", "#labour");

        categories.renameCategory(family.id, "Family law");
        assertThat(categories.findById(family.id)).map(c -> c.name).contains("Family law");

        assertThatThrownBy(() -> categories.renameCategory(family.id, "Labour"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> categories.renameCategory(999L, "Tax"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteRefusesReferencedCategory() {
        Category family = categories.createCategory("Family", "#family");
        Category unused = categories.createCategory("Tax", "#tax");
        fx.pending(1L, family);

        assertThatThrownBy(() -> categories.deleteCategory(family.id))
                .isInstanceOf(ConflictException.class)
                .extracting(e -> ((ConflictException) e).reason())
                .isEqualTo(ConflictException.Reason.CATEGORY_IN_USE);

        categories.deleteCategory(unused.id);
        assertThat(categories.findById(unused.id)).isEmpty();
        assertThatThrownBy(() -> categories.deleteCategory(unused.id)).isInstanceOf(NotFoundException.class);
    }
}
