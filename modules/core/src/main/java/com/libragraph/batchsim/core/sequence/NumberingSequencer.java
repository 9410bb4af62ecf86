package com.libragraph.batchsim.core.sequence;

import com.libragraph.batchsim.core.config.JobContext;
import com.libragraph.batchsim.core.input.InputNotAvailableException;
import com.libragraph.batchsim.core.input.ProcessScope;
import com.libragraph.batchsim.core.output.OutputType;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each file its first image and object index before any file is built, so
 * numbering is the same however many workers run. File-scope inputs are built for each
 * file before its objects are counted.
 */
public class NumberingSequencer {

    private static final Logger log = Logger.getLogger(NumberingSequencer.class);

    public List<FilePlan> plan(JobContext jobCtx, OutputType outputType, int nfiles) {
        List<FilePlan> plans = new ArrayList<>(nfiles);
        int imageNum = 0;
        int objNum = 0;
        for (int f = 0; f < nfiles; f++) {
            JobContext ctx = jobCtx.copyForTask();
            ctx.startFile(f);
            ctx.inputs().processInputs(ctx, ProcessScope.FILE_SCOPE_ONLY);
            ctx.startFile(f);
            List<Integer> nobj = count(ctx, outputType, f, imageNum);
            FilePlan plan = new FilePlan(f, imageNum, objNum, nobj, ctx);
            log.debugf("file %d: image_num = %d, obj_num = %d, nimages = %d, nobjects = %d",
                    f, imageNum, objNum, plan.nimages(), plan.nobjects());
            plans.add(plan);
            imageNum += plan.nimages();
            objNum += plan.nobjects();
        }
        return plans;
    }

    private static List<Integer> count(JobContext ctx, OutputType outputType, int fileNum, int imageNum) {
        try {
            return outputType.nobjPerFile(ctx, fileNum, imageNum);
        } catch (InputNotAvailableException e) {
            log.debugf("file %d: %s; building count-capable inputs", fileNum, e.getMessage());
            ctx.startFile(fileNum);
            ctx.inputs().processInputs(ctx, ProcessScope.COUNT_CAPABLE_ONLY);
            ctx.startFile(fileNum);
            return outputType.nobjPerFile(ctx, fileNum, imageNum);
        }
    }
}
