// ChessController.java
package com.example.chess.web;

import com.example.chess.game.ChessGame.MoveOutcome;
import com.example.chess.game.ChessJudge;
import com.example.chess.game.ChessRules.*;
import com.example.chess.game.SquareNotation;
import com.example.chess.service.BoardView;
import com.example.chess.service.GameService;
import com.example.chess.service.MoveReport;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/chess")
@CrossOrigin(origins = "*")
public class ChessController {

    private final GameService games;

    public ChessController(GameService games) {
        this.games = games;
    }

    /** New game */
    @PostMapping("/new")
    public Map<String, Object> newGame() {
        BoardView view = games.newGame();

        Map<String, Object> resp = new HashMap<>();
        resp.put("status", "new");
        resp.put("turn", view.turn().toString());
        resp.put("foul", view.foulCount());
        resp.put("gameOver", view.gameOver());
        return resp;
    }

    /** Player move in algebraic notation: {"from":"e2","to":"e4"} */
    @PostMapping("/move")
    public Map<String, Object> playerMove(@RequestBody Map<String, String> move) {
        String from = required(move, "from");
        String to = required(move, "to");
        return toResponse(games.move(from, to));
    }

    /** Player move as raw board indices: {"fromR":6,"fromC":4,"toR":4,"toC":4} */
    @PostMapping("/move/coords")
    public Map<String, Object> playerMoveCoords(@RequestBody Map<String, Integer> move) {
        Pos from = new Pos(required(move, "fromR"), required(move, "fromC"));
        Pos to = new Pos(required(move, "toR"), required(move, "toC"));
        return toResponse(games.move(from, to));
    }

    /** Current board, one entry per square from a8 to h1 */
    @GetMapping("/board")
    public Map<String, Object> board() {
        BoardView view = games.view();

        List<Map<String, Object>> cells = new ArrayList<>();
        for (Cell cell : view.cells()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("square", SquareNotation.format(cell.pos()));
            cell.piece().ifPresent(p -> {
                m.put("piece", String.valueOf(p.symbol()));
                m.put("type", p.type.toString());
                m.put("side", p.side.toString());
            });
            cells.add(m);
        }

        Map<String, Object> resp = new HashMap<>();
        resp.put("turn", view.turn().toString());
        resp.put("gameOver", view.gameOver());
        resp.put("foulCount", view.foulCount());
        resp.put("cells", cells);
        resp.put("text", view.text());
        if (view.gameOver()) putResult(resp, view.result());
        return resp;
    }

    private Map<String, Object> toResponse(MoveReport report) {
        Map<String, Object> resp = new HashMap<>();

        // Game already ended before this request
        if (report.isLate()) {
            resp.put("result", "game_over");
            resp.put("gameOver", true);
            putResult(resp, report.result);
            return resp;
        }

        MoveOutcome outcome = report.outcome;
        if (!outcome.isApplied()) {
            resp.put("result", "foul");
            resp.put("reason", outcome.rejection.name());
            resp.put("message", outcome.message);
            resp.put("foulCount", report.foulCount);
            resp.put("turn", report.turn.toString());
            resp.put("gameOver", false);
            return resp;
        }

        resp.put("move", report.move);
        if (outcome.isCapture()) resp.put("captured", String.valueOf(outcome.captured.symbol()));
        resp.put("turn", report.turn.toString());
        resp.put("foulCount", report.foulCount);
        resp.put("gameOver", report.isGameOver());
        if (report.isGameOver()) {
            resp.put("result", "game_over");
            putResult(resp, report.result);
        } else {
            resp.put("result", "ok");
        }
        return resp;
    }

    private void putResult(Map<String, Object> resp, ChessJudge.GameResult result) {
        Side winner = ChessJudge.winner(result);
        resp.put("winner", winner != null ? winner.toString() : null);
        resp.put("gameResult", result.getDescription());
        resp.put("resultDescription", ChessJudge.getResultDescription(result));
    }

    private static <T> T required(Map<String, T> body, String key) {
        T v = body == null ? null : body.get(key);
        if (v == null) throw new IllegalArgumentException("Missing field: " + key);
        return v;
    }
}
