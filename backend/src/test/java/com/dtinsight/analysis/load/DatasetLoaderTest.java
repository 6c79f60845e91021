package com.dtinsight.analysis.load;

import com.dtinsight.analysis.engine.LookupResolver;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.LookupField;
import com.dtinsight.analysis.model.LookupMode;
import com.dtinsight.analysis.model.MatchResult;
import com.dtinsight.analysis.schema.SchemaClassifier;
import com.dtinsight.config.AnalysisProperties;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetLoaderTest {

    private final DatasetLoader loader = new DatasetLoader(new AnalysisProperties());

    @Test
    void csvFixtureRenamesAnonymousIndexToIdentifier() throws IOException {
        Dataset dataset;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/companies.csv")) {
            dataset = loader.load("companies.csv", in);
        }

        assertThat(dataset.columns()).containsExactly(
            "股票代码", "企业名称", "行业", "数字化转型总指数", "战略转型", "技术应用", "组织变革", "备注");
        assertThat(dataset.size()).isEqualTo(6);
        assertThat(dataset.source()).isEqualTo("companies.csv");

        CompanyRecord first = dataset.records().get(0);
        assertThat(first.get("股票代码")).isEqualTo(300884L);
        assertThat(first.get("数字化转型总指数")).isEqualTo(72.5);
        assertThat(first.get("战略转型")).isEqualTo(70L);
        assertThat(first.get("备注")).isNull();
        assertThat(dataset.records().get(1).get("备注")).isEqualTo("龙头");
        assertThat(dataset.records().get(2).get("技术应用")).isNull();
        assertThat(dataset.records().get(5).metric("数字化转型总指数")).isNull();
    }

    @Test
    void csvMissingTokensAndNumericTextAreNormalized() {
        String csv = "\uFEFFstock code,company name,score,note\n"
            + "1,Alpha,1.5,n/a\n"
            + "2,Beta,NaN,ok\n"
            + "3,Gamma, 2 ,\n";

        Dataset dataset = loader.load("sample.csv", stream(csv));

        assertThat(dataset.columns()).containsExactly("stock code", "company name", "score", "note");
        assertThat(dataset.records()).extracting(r -> r.get("score")).containsExactly(1.5, null, 2.0);
        assertThat(dataset.records()).extracting(r -> r.get("note")).containsExactly(null, "ok", null);
        assertThat(dataset.records().get(0).get("stock code")).isEqualTo(1L);
    }

    @Test
    void exportedIndexNextToStockCodeKeepsStockCodeAsIdentifier() {
        String csv = ",股票代码,行业,score\n0,300884,软件服务,1.5\n1,2230,人工智能,2.5\n";

        Dataset dataset = loader.load("indexed.csv", stream(csv));
        ColumnClassification classification = new SchemaClassifier(new AnalysisProperties()).classify(dataset);
        MatchResult match = new LookupResolver()
            .resolve(dataset, classification, "300884", LookupField.IDENTIFIER, LookupMode.EXACT);

        assertThat(dataset.columns()).containsExactly("Unnamed: 0", "股票代码", "行业", "score");
        assertThat(classification.identifierColumn()).isEqualTo("股票代码");
        assertThat(classification.metricColumns()).containsExactly("score");
        assertThat(match.size()).isEqualTo(1);
    }

    @Test
    void duplicateAndBlankHeadersGetDistinctNames() {
        String csv = "股票代码,a,a,\n1,2,3,4\n";

        Dataset dataset = loader.load("dup.csv", stream(csv));

        assertThat(dataset.columns()).containsExactly("股票代码", "a", "a.1", "Unnamed: 3");
    }

    @Test
    void workbookFirstSheetIsRead(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("merged_data.xlsx");
        Files.write(file, workbookBytes());

        Dataset dataset = loader.load(file);

        assertThat(dataset.columns()).containsExactly("股票代码", "企业名称", "行业", "数字化转型总指数");
        assertThat(dataset.size()).isEqualTo(2);
        CompanyRecord record = dataset.records().get(1);
        assertThat(record.get("股票代码")).isEqualTo(2230L);
        assertThat(record.text("企业名称")).isEqualTo("科大讯飞");
        assertThat(record.get("数字化转型总指数")).isEqualTo(88.25);
        assertThat(dataset.source()).isEqualTo("merged_data.xlsx");
    }

    @Test
    void unsupportedExtensionIsRejected() {
        assertThatThrownBy(() -> loader.load("data.json", stream("{}")))
            .isInstanceOf(DatasetLoadException.class)
            .hasMessageContaining("unsupported file type");
    }

    @Test
    void corruptWorkbookIsReportedAsLoadFailure() {
        assertThatThrownBy(() -> loader.load("broken.xlsx", stream("not a workbook")))
            .isInstanceOf(DatasetLoadException.class)
            .hasMessageContaining("broken.xlsx");
    }

    @Test
    void missingFileIsReportedAsLoadFailure(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.xlsx")))
            .isInstanceOf(DatasetLoadException.class)
            .hasMessageContaining("not found");
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] workbookBytes() throws IOException {
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("merged");
            Row header = sheet.createRow(0);
            header.createCell(1).setCellValue("企业名称");
            header.createCell(2).setCellValue("行业");
            header.createCell(3).setCellValue("数字化转型总指数");
            header.createCell(0).setCellValue("");

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(300884);
            first.createCell(1).setCellValue("狄耐克");
            first.createCell(2).setCellValue("软件服务");
            first.createCell(3).setCellValue(72.5);

            Row second = sheet.createRow(2);
            second.createCell(0).setCellValue(2230);
            second.createCell(1).setCellValue("科大讯飞");
            second.createCell(2).setCellValue("人工智能");
            second.createCell(3).setCellValue(88.25);

            workbook.createSheet("ignored").createRow(0).createCell(0).setCellValue("other");
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
