package photorestore;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.text.DecimalFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javafx.application.Application;
import javafx.embed.swing.SwingFXUtils;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.TextField;
import javafx.scene.image.ImageView;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

public class MainGUI extends Application {

    private static final Logger logger = LoggerFactory.getLogger(MainGUI.class);

    private File selectedFile;
    private final ImageView inputPreview = new ImageView();
    private final ImageView outputPreview = new ImageView();
    private final ImageView maskPreview = new ImageView();
    private final Label resultLabel = new Label();
    private final DecimalFormat df = new DecimalFormat("#.##");

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("Photo Restoration");

        ComboBox<ProcessorType> methodCombo = new ComboBox<>();
        methodCombo.getItems().addAll(ProcessorType.FORKJOIN, ProcessorType.EXECUTOR);
        methodCombo.setValue(ProcessorType.FORKJOIN);

        TextField threadInput = new TextField(String.valueOf(Runtime.getRuntime().availableProcessors()));
        TextField radiusInput = new TextField(String.valueOf(FeatherStage.DEFAULT_RADIUS));

        Button fileButton = new Button("Choose Photo");
        Label fileLabel = new Label("No file selected");

        fileButton.setOnAction(event -> {
            FileChooser chooser = new FileChooser();
            chooser.getExtensionFilters().add(
                    new FileChooser.ExtensionFilter("Images", "*.jpg", "*.jpeg", "*.png", "*.bmp"));
            File file = chooser.showOpenDialog(primaryStage);
            if (file != null) {
                selectedFile = file;
                fileLabel.setText(file.getName());
                // Always clear output preview on new upload
                outputPreview.setImage(null);
                maskPreview.setImage(null);
                try {
                    PixelGrid image = ImageCodec.read(file.toPath());
                    showPreview(inputPreview, image.toImage());
                } catch (IOException e) {
                    logger.warn("Cannot preview {}: {}", file, e.getMessage());
                    resultLabel.setText("Error: " + e.getMessage());
                }
            }
        });

        Button runButton = new Button("Restore");
        runButton.setOnAction(event -> {
            if (selectedFile == null) {
                resultLabel.setText("No file selected.");
                return;
            }

            try {
                RestorationConfig config = RestorationConfig.builder()
                        .fromProperties(RestorationConfig.bundledDefaults())
                        .workers(Integer.parseInt(threadInput.getText().trim()))
                        .featherRadius(Integer.parseInt(radiusInput.getText().trim()))
                        .processorType(methodCombo.getValue())
                        .build();
                RestorationPipeline pipeline = new RestorationPipeline(config);
                PixelGrid original = ImageCodec.read(selectedFile.toPath());

                long t1s = System.nanoTime();
                pipeline.restore(original, StageExecutor.sequential());
                long t1e = System.nanoTime();

                long t2s = System.nanoTime();
                RestorationResult result = pipeline.restore(original);
                long t2e = System.nanoTime();

                double seqMs = (t1e - t1s) / 1e6;
                double parMs = (t2e - t2s) / 1e6;
                double speedup = seqMs / parMs;

                showPreview(outputPreview, result.getRestored().toImage());
                showPreview(maskPreview, result.getFeatheredMask().toGrayImage());
                Path output = restoredPath(selectedFile.toPath());
                ImageCodec.write(result.getRestored(), output);

                resultLabel.setText(
                    "Image done, saved to " + output.getFileName() + "\n" +
                    "Speedup: " + df.format(speedup) + "x    " +
                    "Sequential Time: " + df.format(seqMs) + "ms    " +
                    "Parallel Time: " + df.format(parMs) + "ms    " +
                    "Damaged pixels: " + result.getMask().countSaturated()
                );
            } catch (Exception ex) {
                logger.warn("Restoration failed", ex);
                resultLabel.setText("Error: " + ex.getMessage());
            }
        });

        VBox controls = new VBox(10,
                new Label("Processor Method:"), methodCombo,
                new Label("Threads:"), threadInput,
                new Label("Feather Radius:"), radiusInput,
                fileButton, fileLabel, runButton, resultLabel);
        controls.setPadding(new Insets(10));
        controls.setAlignment(Pos.TOP_LEFT);

        VBox leftBox = new VBox(10, new Label("Input Preview"), inputPreview);
        VBox middleBox = new VBox(10, new Label("Feathered Mask"), maskPreview);
        VBox rightBox = new VBox(10, new Label("Restored Preview"), outputPreview);
        leftBox.setAlignment(Pos.CENTER);
        middleBox.setAlignment(Pos.CENTER);
        rightBox.setAlignment(Pos.CENTER);

        HBox previews = new HBox(30, leftBox, middleBox, rightBox);
        previews.setAlignment(Pos.CENTER);
        previews.setPadding(new Insets(10));

        VBox root = new VBox(20, controls, previews);
        root.setPadding(new Insets(20));
        Scene scene = new Scene(root, 1100, 700);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    private static void showPreview(ImageView view, BufferedImage image) {
        view.setImage(SwingFXUtils.toFXImage(image, null));
        view.setFitWidth(320);
        view.setPreserveRatio(true);
        view.setSmooth(true);
        view.setStyle("-fx-effect: dropshadow(three-pass-box, rgba(0,0,0,0.6), 10, 0, 0, 0);");
    }

    static Path restoredPath(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot < 0 ? name : name.substring(0, dot);
        return input.resolveSibling(base + "_restored.jpg");
    }

    public static void main(String[] args) {
        launch(args);
    }
}
